package org.angnysa.minequest.grid;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>
 *     Reveals the neighborhood of a revealed numbered cell once the player
 *     has flagged as many neighbors as the number says.
 * </p>
 * <p>
 *     The neighbors are listed and their flags counted before anything is
 *     revealed. With a wrong count nothing is revealed at all. With the right
 *     count every unflagged hidden neighbor is revealed exactly as
 *     {@link Grid#revealCell(int, int)} would, cascades and mines included.
 * </p>
 */
@Log4j2
final class ChordResolver {

    private ChordResolver() {
    }

    static List<Cell> chord(@NonNull Grid grid, int x, int y) {
        Cell cell = grid.getCell(x, y);
        if (cell == null || !cell.isRevealed() || cell.isMine() || cell.getNumber() == 0) {
            return Collections.emptyList();
        }

        List<Cell> neighbors = grid.getNeighbors(x, y);
        int flags = 0;
        for (Cell neighbor : neighbors) {
            if (neighbor.isFlagged()) {
                flags++;
            }
        }

        if (flags != cell.getNumber()) {
            log.debug("Chord refused on {}: {} flags around number {}", cell, flags, cell.getNumber());
            return Collections.emptyList();
        }

        List<Cell> revealed = new ArrayList<>();
        for (Cell neighbor : neighbors) {
            if (!neighbor.isRevealed() && !neighbor.isFlagged()) {
                // an earlier neighbor's cascade may already have revealed it
                revealed.addAll(grid.revealCell(neighbor.getX(), neighbor.getY()));
            }
        }
        return revealed;
    }
}
