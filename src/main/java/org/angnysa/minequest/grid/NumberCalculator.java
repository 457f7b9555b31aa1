package org.angnysa.minequest.grid;

import lombok.NonNull;

/**
 * Stores in every safe cell the number of mines around it.
 */
final class NumberCalculator {

    private NumberCalculator() {
    }

    static void calculate(@NonNull Grid grid) {
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                Cell cell = grid.getCell(x, y);
                if (!cell.isMine()) {
                    cell.setNumber(countAdjacentMines(grid, cell));
                }
            }
        }
    }

    static int countAdjacentMines(@NonNull Grid grid, @NonNull Cell cell) {
        int count = 0;
        for (Cell neighbor : grid.getNeighbors(cell.getX(), cell.getY())) {
            if (neighbor.isMine()) {
                count++;
            }
        }
        return count;
    }
}
