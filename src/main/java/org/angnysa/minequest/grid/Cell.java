package org.angnysa.minequest.grid;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;

/**
 * <p>
 *     A single position of a {@link Grid}.
 * </p>
 * <p>
 *     The mine, trap and cursed tags and the surrounding mines count are
 *     assigned once while the grid is built. Afterwards only the revealed and
 *     flagged states change, and only through the owning grid. Cells are
 *     compared by their coordinates.
 * </p>
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Cell {
    @EqualsAndHashCode.Include
    private final int x;
    @EqualsAndHashCode.Include
    private final int y;
    private boolean mine;
    /** Non-lethal hazard. Never set on a mine. */
    private boolean trap;
    /** Resource penalty. Never set on a mine or a trap. */
    private boolean cursed;
    private boolean revealed;
    private boolean flagged;
    /**
     * Number of mines among the neighbors. Always 0 on a mine.
     */
    private int number;

    /**
     * Whether the cell carries no tag at all, so a mine or a hazard can
     * still be placed on it.
     *
     * @return {@code true} if the cell is neither a mine, a trap nor cursed
     */
    boolean isPlain() {
        return !mine && !trap && !cursed;
    }

    /**
     * One character picture of the cell, as a player would see it.
     *
     * @return {@code '#'} hidden, {@code '!'} flagged, {@code '*'} revealed
     * mine, {@code ' '} or a digit for a revealed safe cell
     */
    public char getChar() {
        if (isFlagged()) {
            return '!';
        } else if (!isRevealed()) {
            return '#';
        } else if (isMine()) {
            return '*';
        } else {
            return " 12345678".charAt(getNumber());
        }
    }

    @Override
    public String toString() {
        return String.format("Cell(%c)[%d, %d]"
                , isFlagged() ? 'F' : isMine() ? 'M' : isRevealed() ? 'R' : 'H'
                , x, y);
    }
}
