package org.angnysa.minequest.board;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Board scaling presets. {@link #CUSTOM} takes its scales from the
 * {@link BoardSettings} instead.
 */
@Getter
@RequiredArgsConstructor
public enum Difficulty {
    EASY("Easy", 0.8, 0.8),
    NORMAL("Normal", 1.0, 1.0),
    HARD("Hard", 1.15, 1.2),
    CUSTOM("Custom", 1.0, 1.0);

    private final String displayName;
    /** Multiplier applied to the board width and height */
    private final double sizeScale;
    /** Multiplier applied to the mine density */
    private final double mineScale;
}
