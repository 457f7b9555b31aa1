package org.angnysa.minequest.board;

import lombok.Value;

/**
 * Outcome of {@link BoardCatalog#validateCustomBoard(int, int, int)}, with
 * the limits a settings screen needs to guide the player.
 */
@Value
public class CustomBoardValidation {
    boolean valid;
    int minWidth;
    int maxWidth;
    int minHeight;
    int maxHeight;
    int minMines;
    int maxMines;
    /** Mine density in percent, rounded */
    int density;
}
