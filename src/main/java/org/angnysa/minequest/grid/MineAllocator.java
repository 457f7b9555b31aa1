package org.angnysa.minequest.grid;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import java.util.Random;
import java.util.function.Consumer;

/**
 * <p>
 *     Places tags on random cells by rejection sampling: a coordinate is
 *     drawn uniformly, and drawn again as long as it lands on a cell that
 *     already carries a tag.
 * </p>
 * <p>
 *     The caller must guarantee that enough untagged cells remain, which
 *     {@link GridConfiguration#validate()} does. Nothing is checked here.
 * </p>
 */
@Log4j2
@RequiredArgsConstructor
class MineAllocator {

    @NonNull private final Random rng;

    void placeMines(@NonNull Cell[][] map, int count) {
        place(map, count, "mine", c -> c.setMine(true));
    }

    void placeTraps(@NonNull Cell[][] map, int count) {
        place(map, count, "trap", c -> c.setTrap(true));
    }

    void placeCurses(@NonNull Cell[][] map, int count) {
        place(map, count, "cursed", c -> c.setCursed(true));
    }

    private void place(Cell[][] map, int count, String tag, Consumer<Cell> marker) {
        int height = map.length;
        int width = map[0].length;
        long draws = 0;

        int placed = 0;
        while (placed < count) {
            Cell cell = map[rng.nextInt(height)][rng.nextInt(width)];
            draws++;
            if (cell.isPlain()) {
                marker.accept(cell);
                placed++;
            }
        }

        if (log.isTraceEnabled()) {
            log.trace(String.format("Placed %d %s cells in %d draws", count, tag, draws));
        }
    }
}
