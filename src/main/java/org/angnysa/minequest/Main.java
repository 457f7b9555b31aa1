package org.angnysa.minequest;

import org.angnysa.minequest.board.Board;
import org.angnysa.minequest.board.BoardCatalog;
import org.angnysa.minequest.board.BoardSettings;
import org.angnysa.minequest.board.ScaledBoard;
import org.angnysa.minequest.grid.Cell;
import org.angnysa.minequest.grid.Grid;

import java.util.List;
import java.util.Random;

public class Main {
    private static final int BOARD = 1;
    private static final long SEED = new Random().nextLong();
    private static final int MAX_MOVES = 1000;

    public static void main(String[] args) {

        System.out.println("seed: "+SEED);
        ScaledBoard scaled = BoardCatalog.getScaledBoard(BOARD, BoardSettings.defaults())
                .orElseThrow(() -> new IllegalStateException("No board "+BOARD));
        Board board = scaled.getBoard();
        System.out.println(String.format("Creating board %d '%s' (%dx%d, %d mines) ..."
                , board.getNumber(), board.getDisplayName(), scaled.getWidth(), scaled.getHeight(), scaled.getMines()));

        Random rng = new Random(SEED);
        Grid grid = new Grid(scaled.toGridConfiguration(), rng);

        long start=System.nanoTime();
        boolean exploded = false;
        int moves = 0;
        int x = grid.getWidth()/2;
        int y = grid.getHeight()/2;
        do {
            List<Cell> revealed = grid.revealCell(x, y);
            if (!revealed.isEmpty()) {
                moves++;
                exploded = revealed.stream().anyMatch(Cell::isMine);
                System.out.println(String.format("Move %d at [%d, %d] revealed %d cells", moves, x, y, revealed.size()));
            }
            x = rng.nextInt(grid.getWidth());
            y = rng.nextInt(grid.getHeight());
        } while (!exploded && !grid.isComplete() && moves < MAX_MOVES);

        long delta = System.nanoTime()-start;
        grid.revealAllMines();
        System.out.println();
        System.out.print(grid.render());
        System.out.println();
        System.out.println(exploded ? "Hit a mine" : grid.isComplete() ? "Board complete" : "Gave up");
        System.out.println(String.format("Revealed %d/%d safe cells in %d moves, %d µs"
                , grid.getRevealed(), grid.getSafeCellCount(), moves, delta/1000));
    }
}
