package org.angnysa.minequest.grid;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * <p>
 *     Reveals a cell and, when it has no mine around it, the whole area
 *     connected to it through such cells plus the numbered cells bordering
 *     that area.
 * </p>
 * <p>
 *     Large empty fields would overflow the stack of a recursive fill, so
 *     the area is explored with a work queue. A cell is revealed as soon as
 *     it is queued, which also marks it visited: it is never queued twice.
 *     Flagged cells are left alone and stop the expansion.
 * </p>
 */
@Log4j2
final class RevealCascade {

    private RevealCascade() {
    }

    /**
     * @param grid The owning grid
     * @param start A hidden, unflagged cell of <code>grid</code>
     * @return The revealed cells, <code>start</code> first
     */
    static List<Cell> reveal(@NonNull Grid grid, @NonNull Cell start) {
        List<Cell> revealed = new ArrayList<>();
        grid.markRevealed(start);
        revealed.add(start);

        if (!expands(start)) {
            return revealed;
        }

        Deque<Cell> queue = new ArrayDeque<>();
        queue.addLast(start);
        while (!queue.isEmpty()) {
            Cell cell = queue.removeFirst();
            for (Cell neighbor : grid.getNeighbors(cell.getX(), cell.getY())) {
                if (!neighbor.isRevealed() && !neighbor.isFlagged()) {
                    grid.markRevealed(neighbor);
                    revealed.add(neighbor);
                    if (expands(neighbor)) {
                        queue.addLast(neighbor);
                    }
                }
            }
        }

        if (log.isTraceEnabled()) {
            log.trace(String.format("Cascade from %s revealed %d cells", start, revealed.size()));
        }
        return revealed;
    }

    private static boolean expands(Cell cell) {
        return !cell.isMine() && cell.getNumber() == 0;
    }
}
