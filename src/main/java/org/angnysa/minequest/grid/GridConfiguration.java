package org.angnysa.minequest.grid;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * <p>
 *     Dimensions and contents of a {@link Grid} to build.
 * </p>
 * <p>
 *     The rules are checked by {@link #getViolations()}, which has no side
 *     effect, and enforced by {@link #validate()}. A grid always validates
 *     its configuration before placing anything, so the random placement
 *     loops can rely on enough free cells being available.
 * </p>
 * <ul>
 *     <li><code>width &gt; 0</code> and <code>height &gt; 0</code></li>
 *     <li><code>0 &lt;= mineCount &lt; width * height - 1</code></li>
 *     <li><code>trapCount &gt;= 0</code> and <code>cursedCount &gt;= 0</code></li>
 *     <li><code>trapCount + cursedCount &lt;= width * height - mineCount</code></li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class GridConfiguration {
    int width;
    int height;
    int mineCount;
    @Builder.Default int trapCount = 0;
    @Builder.Default int cursedCount = 0;

    public static GridConfiguration of(int width, int height, int mineCount) {
        return builder().width(width).height(height).mineCount(mineCount).build();
    }

    /**
     * Total number of cells, computed without overflow.
     *
     * @return <code>width * height</code>
     */
    public long getCellCount() {
        return (long) width * height;
    }

    /**
     * Lists the broken rules.
     *
     * @return One message per broken rule, empty if the configuration is valid.
     */
    public List<String> getViolations() {
        List<String> violations = new ArrayList<>();

        if (width <= 0) {
            violations.add(String.format("width %d must be positive", width));
        }
        if (height <= 0) {
            violations.add(String.format("height %d must be positive", height));
        }
        if (mineCount < 0) {
            violations.add(String.format("mine count %d must not be negative", mineCount));
        }
        if (trapCount < 0) {
            violations.add(String.format("trap count %d must not be negative", trapCount));
        }
        if (cursedCount < 0) {
            violations.add(String.format("cursed count %d must not be negative", cursedCount));
        }

        // the remaining rules are meaningless on a malformed grid
        if (violations.isEmpty()) {
            long cells = getCellCount();
            if (mineCount >= cells - 1) {
                violations.add(String.format("too many mines (%d) for a %dx%d grid (%d cells), maximum is %d"
                        , mineCount, width, height, cells, cells - 2));
            } else if ((long) trapCount + cursedCount > cells - mineCount) {
                violations.add(String.format("%d traps and %d cursed cells do not fit in %d safe cells"
                        , trapCount, cursedCount, cells - mineCount));
            }
        }

        return violations;
    }

    public boolean isValid() {
        return getViolations().isEmpty();
    }

    /**
     * Enforces the rules.
     *
     * @return this configuration, for chaining
     * @throws ConfigurationException if at least one rule is broken
     */
    public GridConfiguration validate() throws ConfigurationException {
        List<String> violations = getViolations();
        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
        return this;
    }
}
