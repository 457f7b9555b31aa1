package org.angnysa.minequest.grid;

import java.util.List;

/**
 * <p>
 *     The operations a host can perform on a minesweeper board.
 * </p>
 * <p>
 *     None of the gameplay operations throw on a move the rules refuse: an
 *     out of bounds coordinate, an already revealed cell, a flagged cell or a
 *     chord on a wrongly flagged neighborhood simply leaves the field
 *     untouched and reports an empty result. Player moves and ability effects
 *     go through the same operations.
 * </p>
 * <p>
 *     Implementations are not thread-safe. Callers must serialize their calls.
 * </p>
 */
public interface MineField {

    int getWidth();

    int getHeight();

    /**
     * Number of mines on the field. Fixed at creation.
     *
     * @return The number of mines on the field.
     */
    int getMineCount();

    /**
     * Number of safe cells revealed so far. Mines never count.
     *
     * @return The number of revealed safe cells.
     */
    int getRevealed();

    /**
     * Number of cells currently flagged.
     *
     * @return The number of flagged cells.
     */
    int getFlagged();

    /**
     * Whether the coordinates are inside the field.
     *
     * @param x The column
     * @param y The row
     * @return Whether the coordinates are inside the field.
     */
    boolean isValid(int x, int y);

    /**
     * Looks up a cell.
     *
     * @param x The column
     * @param y The row
     * @return The cell, or <code>null</code> if the coordinates are outside the field.
     */
    Cell getCell(int x, int y);

    /**
     * Reveals a cell. A safe cell without neighboring mines also reveals
     * the connected area of such cells and its numbered border. Flagged
     * cells are never revealed by the cascade.
     *
     * @param x The column
     * @param y The row
     * @return Every cell revealed by this call, the target first. Empty if
     * the target is outside the field, already revealed or flagged.
     */
    List<Cell> revealCell(int x, int y);

    /**
     * Flags or unflags a hidden cell.
     *
     * @param x The column
     * @param y The row
     * @return Whether the flag was toggled. <code>false</code> if the target
     * is outside the field or already revealed.
     */
    boolean toggleFlag(int x, int y);

    /**
     * Reveals the unflagged hidden neighbors of a revealed numbered cell,
     * provided exactly as many neighbors as its number are flagged.
     *
     * @param x The column
     * @param y The row
     * @return Every cell revealed by this call, mines included. Empty if the
     * target is not eligible or its flagged neighbor count does not match.
     */
    List<Cell> chord(int x, int y);

    /**
     * Whether every safe cell has been revealed. Flags are ignored.
     *
     * @return Whether the field is solved.
     */
    boolean isComplete();

    /**
     * Reveals every mine, for example when the run is over. Does not change
     * {@link #getRevealed()}. Calling it again has no further effect.
     */
    void revealAllMines();
}
