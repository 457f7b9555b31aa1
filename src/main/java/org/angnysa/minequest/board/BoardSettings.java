package org.angnysa.minequest.board;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Player preferences that reshape the boards of a run.
 */
@Value
@Builder
public class BoardSettings {
    @NonNull @Builder.Default Difficulty difficulty = Difficulty.NORMAL;

    /** Size scale in percent, used by {@link Difficulty#CUSTOM} without custom dimensions */
    @Builder.Default int boardSizeScale = 100;
    /** Mine density scale in percent, used by {@link Difficulty#CUSTOM} without custom dimensions */
    @Builder.Default int mineDensityScale = 100;

    /** With {@link Difficulty#CUSTOM}, use the exact dimensions below instead of scaling */
    boolean useCustomDimensions;
    @Builder.Default int customWidth = 10;
    @Builder.Default int customHeight = 10;
    @Builder.Default int customMines = 15;

    public static BoardSettings defaults() {
        return builder().build();
    }
}
