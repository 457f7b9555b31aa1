package org.angnysa.minequest.board;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.angnysa.minequest.grid.GridConfiguration;

/**
 * A {@link Board} resized by the player's {@link BoardSettings}.
 */
@Value
@Builder
public class ScaledBoard {
    @NonNull Board board;
    int width;
    int height;
    int mines;
    /** Whether the dimensions come verbatim from the settings rather than from scaling */
    boolean customDimensions;
    double appliedSizeScale;
    double appliedMineScale;

    public GridConfiguration toGridConfiguration() {
        return GridConfiguration.of(width, height, mines);
    }
}
