package org.angnysa.minequest.board;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import java.util.Optional;

/**
 * <p>
 *     Looks up the boards of a run and resizes them to the player's settings.
 * </p>
 * <p>
 *     Resized boards stay between {@value #MIN_SIZE} and {@value #MAX_SIZE}
 *     cells per side and hold at least {@value #MIN_MINES} mines, leaving at
 *     least {@value #SAFE_MARGIN} safe cells. Every resized board therefore
 *     yields a valid {@link org.angnysa.minequest.grid.GridConfiguration}.
 * </p>
 */
@Log4j2
public final class BoardCatalog {
    public static final int MIN_SIZE = 6;
    public static final int MAX_SIZE = 30;
    public static final int MIN_MINES = 5;
    public static final int SAFE_MARGIN = 9;

    private BoardCatalog() {
    }

    /**
     * @param number The 1-based board number
     * @return The board, or empty if <code>number</code> is not part of a run
     */
    public static Optional<Board> getBoard(int number) {
        for (Board board : Board.values()) {
            if (board.getNumber() == number) {
                return Optional.of(board);
            }
        }
        return Optional.empty();
    }

    public static int getTotalBoards() {
        return Board.values().length;
    }

    public static boolean isBossBoard(int number) {
        return number == getTotalBoards();
    }

    /**
     * Resizes a board.
     *
     * @param number The 1-based board number
     * @param settings The player's settings
     * @return The resized board, or empty if <code>number</code> is not part of a run
     */
    public static Optional<ScaledBoard> getScaledBoard(int number, @NonNull BoardSettings settings) {
        return getBoard(number).map(board -> scale(board, settings));
    }

    static ScaledBoard scale(@NonNull Board board, @NonNull BoardSettings settings) {
        Difficulty difficulty = settings.getDifficulty();

        if (difficulty == Difficulty.CUSTOM && settings.isUseCustomDimensions()) {
            int width = clamp(settings.getCustomWidth(), MIN_SIZE, MAX_SIZE);
            int height = clamp(settings.getCustomHeight(), MIN_SIZE, MAX_SIZE);
            int mines = clamp(settings.getCustomMines(), MIN_MINES, width * height - SAFE_MARGIN);
            return ScaledBoard.builder()
                    .board(board)
                    .width(width)
                    .height(height)
                    .mines(mines)
                    .customDimensions(true)
                    .appliedSizeScale(1.0)
                    .appliedMineScale(1.0)
                    .build();
        }

        double sizeScale;
        double mineScale;
        if (difficulty == Difficulty.CUSTOM) {
            sizeScale = settings.getBoardSizeScale() / 100.0;
            mineScale = settings.getMineDensityScale() / 100.0;
        } else {
            sizeScale = difficulty.getSizeScale();
            mineScale = difficulty.getMineScale();
        }

        int width = clamp((int) Math.round(board.getWidth() * sizeScale), MIN_SIZE, MAX_SIZE);
        int height = clamp((int) Math.round(board.getHeight() * sizeScale), MIN_SIZE, MAX_SIZE);
        int cells = width * height;
        int mines = clamp((int) Math.round(cells * board.getMineDensity() * mineScale)
                , MIN_MINES, cells - SAFE_MARGIN);

        log.debug("Scaled {} to {}x{} with {} mines ({})", board, width, height, mines, difficulty);
        return ScaledBoard.builder()
                .board(board)
                .width(width)
                .height(height)
                .mines(mines)
                .customDimensions(false)
                .appliedSizeScale(sizeScale)
                .appliedMineScale(mineScale)
                .build();
    }

    /**
     * Checks dimensions typed by the player on the custom board screen.
     *
     * @param width The requested width
     * @param height The requested height
     * @param mines The requested number of mines
     * @return The verdict and the limits that apply to these dimensions
     */
    public static CustomBoardValidation validateCustomBoard(int width, int height, int mines) {
        int cells = width * height;
        int maxMines = cells - SAFE_MARGIN;
        int density = cells > 0 ? (int) Math.round(100.0 * mines / cells) : 0;

        boolean valid = width >= MIN_SIZE && width <= MAX_SIZE
                && height >= MIN_SIZE && height <= MAX_SIZE
                && mines >= MIN_MINES && mines <= maxMines;

        return new CustomBoardValidation(valid, MIN_SIZE, MAX_SIZE, MIN_SIZE, MAX_SIZE, MIN_MINES, maxMines, density);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
