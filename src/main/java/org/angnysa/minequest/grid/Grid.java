package org.angnysa.minequest.grid;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.Consumer;

/**
 * <p>
 *     In-memory, randomly generated implementation of {@link MineField}.
 * </p>
 * <p>
 *     Building a grid validates its {@link GridConfiguration} first, then
 *     places the mines, the traps and the cursed cells on distinct random
 *     cells, and finally computes the number of every safe cell. No area is
 *     kept free of mines around the first move.
 * </p>
 * <p>
 *     Cells are stored row by row and addressed as <code>map[y][x]</code>.
 * </p>
 */
@Log4j2
public class Grid implements MineField {

    @Getter private final GridConfiguration configuration;
    private final Cell[][] map;
    @Getter private int revealed;
    @Getter private int flagged;

    public Grid(int width, int height, int mines) {
        this(GridConfiguration.of(width, height, mines));
    }

    public Grid(@NonNull GridConfiguration configuration) {
        this(configuration, new Random());
    }

    public Grid(@NonNull GridConfiguration configuration, long seed) {
        this(configuration, new Random(seed));
    }

    /**
     * Builds a random grid.
     *
     * @param configuration The grid to build
     * @param rng The source of every random placement
     * @throws ConfigurationException if the configuration is invalid. Nothing
     * has been allocated at that point.
     */
    public Grid(@NonNull GridConfiguration configuration, @NonNull Random rng) throws ConfigurationException {
        this.configuration = configuration.validate();
        this.map = createMap(configuration.getWidth(), configuration.getHeight());

        MineAllocator allocator = new MineAllocator(rng);
        allocator.placeMines(map, configuration.getMineCount());
        allocator.placeTraps(map, configuration.getTrapCount());
        allocator.placeCurses(map, configuration.getCursedCount());

        NumberCalculator.calculate(this);
        log.debug("Created {}", this);
    }

    private Grid(GridConfiguration configuration, Cell[][] map) {
        this.configuration = configuration;
        this.map = map;
        NumberCalculator.calculate(this);
        log.debug("Parsed {}", this);
    }

    /**
     * <p>
     *     Builds a grid from a fixed layout, one string per row:
     * </p>
     * <ul>
     *     <li><code>*</code> a mine</li>
     *     <li><code>T</code> a trap</li>
     *     <li><code>C</code> a cursed cell</li>
     *     <li><code>.</code> a plain safe cell</li>
     * </ul>
     * <p>
     *     The layout obeys the same rules as a random grid.
     * </p>
     *
     * @param rows The layout, top row first
     * @return The grid, every cell hidden
     * @throws ConfigurationException if the rows are missing, ragged, contain
     * an unknown character or break a {@link GridConfiguration} rule
     */
    public static Grid parse(@NonNull String... rows) throws ConfigurationException {
        if (rows.length == 0 || rows[0].isEmpty()) {
            throw new ConfigurationException(Collections.singletonList("layout is empty"));
        }

        int width = rows[0].length();
        int mines = 0;
        int traps = 0;
        int curses = 0;
        for (int y = 0; y < rows.length; y++) {
            if (rows[y].length() != width) {
                throw new ConfigurationException(Collections.singletonList(
                        String.format("row %d has %d cells, expected %d", y, rows[y].length(), width)));
            }
            for (int x = 0; x < width; x++) {
                switch (rows[y].charAt(x)) {
                    case '*': mines++; break;
                    case 'T': traps++; break;
                    case 'C': curses++; break;
                    case '.': break;
                    default:
                        throw new ConfigurationException(Collections.singletonList(
                                String.format("unknown cell '%c' at [%d, %d]", rows[y].charAt(x), x, y)));
                }
            }
        }

        GridConfiguration configuration = GridConfiguration.builder()
                .width(width)
                .height(rows.length)
                .mineCount(mines)
                .trapCount(traps)
                .cursedCount(curses)
                .build()
                .validate();

        Cell[][] map = createMap(width, rows.length);
        for (int y = 0; y < rows.length; y++) {
            for (int x = 0; x < width; x++) {
                char c = rows[y].charAt(x);
                map[y][x].setMine(c == '*');
                map[y][x].setTrap(c == 'T');
                map[y][x].setCursed(c == 'C');
            }
        }
        return new Grid(configuration, map);
    }

    private static Cell[][] createMap(int width, int height) {
        Cell[][] map = new Cell[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                map[y][x] = new Cell(x, y);
            }
        }
        return map;
    }

    @Override
    public int getWidth() {
        return map[0].length;
    }

    @Override
    public int getHeight() {
        return map.length;
    }

    @Override
    public int getMineCount() {
        return configuration.getMineCount();
    }

    /**
     * Number of safe cells to reveal to complete the grid.
     *
     * @return <code>width * height - mineCount</code>
     */
    public int getSafeCellCount() {
        return getWidth() * getHeight() - getMineCount();
    }

    /**
     * Mines minus flags, as shown on a mine counter. Negative when the player
     * placed more flags than there are mines.
     *
     * @return <code>mineCount - flagged</code>
     */
    public int getRemainingMineEstimate() {
        return getMineCount() - flagged;
    }

    @Override
    public boolean isValid(int x, int y) {
        return x >= 0 && x < getWidth() && y >= 0 && y < getHeight();
    }

    @Override
    public Cell getCell(int x, int y) {
        return isValid(x, y) ? map[y][x] : null;
    }

    /**
     * Calls {@link Consumer#accept(Object) consumer.accept()} on each cell
     * around <code>[x, y]</code>, skipping positions outside the grid.
     *
     * @param x The column
     * @param y The row
     * @param consumer The callback
     */
    public void forEachNeighbor(int x, int y, @NonNull Consumer<Cell> consumer) {
        for (int ny = y - 1; ny <= y + 1; ny++) {
            if (ny >= 0 && ny < getHeight()) {
                for (int nx = x - 1; nx <= x + 1; nx++) {
                    if (nx >= 0 && nx < getWidth()
                            && (nx != x || ny != y)) {
                        consumer.accept(map[ny][nx]);
                    }
                }
            }
        }
    }

    /**
     * Lists the cells around <code>[x, y]</code>.
     *
     * @param x The column
     * @param y The row
     * @return Up to 8 cells, fewer on the edges.
     */
    public List<Cell> getNeighbors(int x, int y) {
        List<Cell> neighbors = new ArrayList<>(8);
        forEachNeighbor(x, y, neighbors::add);
        return neighbors;
    }

    @Override
    public List<Cell> revealCell(int x, int y) {
        Cell cell = getCell(x, y);
        if (cell == null || cell.isRevealed() || cell.isFlagged()) {
            return Collections.emptyList();
        }
        return RevealCascade.reveal(this, cell);
    }

    @Override
    public boolean toggleFlag(int x, int y) {
        Cell cell = getCell(x, y);
        if (cell == null || cell.isRevealed()) {
            return false;
        }

        cell.setFlagged(!cell.isFlagged());
        flagged += cell.isFlagged() ? 1 : -1;
        return true;
    }

    @Override
    public List<Cell> chord(int x, int y) {
        return ChordResolver.chord(this, x, y);
    }

    @Override
    public boolean isComplete() {
        return revealed == getSafeCellCount();
    }

    /**
     * {@inheritDoc}
     * <p>
     *     A flagged mine loses its flag as it is revealed.
     * </p>
     */
    @Override
    public void revealAllMines() {
        for (Cell[] row : map) {
            for (Cell cell : row) {
                if (cell.isMine()) {
                    if (cell.isFlagged()) {
                        cell.setFlagged(false);
                        flagged--;
                    }
                    cell.setRevealed(true);
                }
            }
        }
    }

    /**
     * Reveals one cell and keeps the safe cell counter in sync.
     */
    void markRevealed(Cell cell) {
        cell.setRevealed(true);
        if (!cell.isMine()) {
            revealed++;
        }
    }

    /**
     * Text picture of the grid as the player sees it, one line per row.
     *
     * @return The picture
     * @see Cell#getChar()
     */
    public String render() {
        StringBuilder res = new StringBuilder();
        for (Cell[] row : map) {
            for (Cell cell : row) {
                res.append(cell.getChar());
            }
            res.append('\n');
        }
        return res.toString();
    }

    @Override
    public String toString() {
        return String.format("Grid(%dx%d, %d mines, %d traps, %d cursed)[revealed=%d, flagged=%d]"
                , getWidth(), getHeight(), getMineCount()
                , configuration.getTrapCount(), configuration.getCursedCount()
                , revealed, flagged);
    }
}
