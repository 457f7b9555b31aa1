package org.angnysa.minequest.board;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.angnysa.minequest.grid.GridConfiguration;

/**
 * The boards of a run, in play order. The last one is the boss board.
 */
@Getter
@RequiredArgsConstructor
public enum Board {
    TUTORIAL(1, "Tutorial", 8, 8, 10, 1.0, "A gentle start"),
    EASY(2, "Easy", 10, 10, 15, 1.0, "Getting warmer"),
    NORMAL(3, "Normal", 12, 12, 25, 1.5, "Standard challenge"),
    HARD(4, "Hard", 14, 14, 35, 2.0, "Things get serious"),
    VERY_HARD(5, "Very Hard", 14, 14, 40, 2.5, "Almost there..."),
    BOSS(6, "Boss", 16, 16, 50, 3.0, "The final challenge");

    /** 1-based position in the run */
    private final int number;
    private final String displayName;
    private final int width;
    private final int height;
    private final int mines;
    /** Coin reward multiplier, read by the economy layer */
    private final double coinMultiplier;
    private final String description;

    public double getMineDensity() {
        return (double) mines / (width * height);
    }

    public GridConfiguration toGridConfiguration() {
        return GridConfiguration.of(width, height, mines);
    }
}
