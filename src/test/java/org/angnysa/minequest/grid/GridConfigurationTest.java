package org.angnysa.minequest.grid;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GridConfigurationTest {

    @ParameterizedTest
    @CsvSource({
            "10, 10, 0",
            "10, 10, 15",
            "10, 10, 98",
            "5, 5, 4",
            "1, 3, 1",
    })
    void acceptsValidConfigurations(int width, int height, int mines) {
        GridConfiguration configuration = GridConfiguration.of(width, height, mines);

        assertTrue(configuration.getViolations().isEmpty(), configuration.getViolations()::toString);
        assertSame(configuration, configuration.validate());
    }

    @ParameterizedTest
    @CsvSource({
            "0, 10, 5",
            "10, 0, 5",
            "-3, 10, 5",
            "10, 10, -1",
            "10, 10, 99",
            "10, 10, 100",
            "10, 10, 101",
            "2, 1, 1",
    })
    void rejectsInvalidConfigurations(int width, int height, int mines) {
        GridConfiguration configuration = GridConfiguration.of(width, height, mines);

        assertFalse(configuration.isValid());
        assertThrows(ConfigurationException.class, configuration::validate);
    }

    @Test
    void tooManyMinesFailsBeforeAllocating() {
        assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
            assertThrows(ConfigurationException.class, () -> new Grid(10, 10, 100));
            assertThrows(ConfigurationException.class, () -> new Grid(10, 10, 101));
            assertThrows(ConfigurationException.class, () -> new Grid(10, 10, 99));
        });
    }

    @Test
    void reportsEveryBrokenRule() {
        GridConfiguration configuration = GridConfiguration.builder()
                .width(0)
                .height(-1)
                .mineCount(-2)
                .trapCount(-1)
                .build();

        ConfigurationException e = assertThrows(ConfigurationException.class, configuration::validate);
        assertEquals(4, e.getViolations().size());
        assertTrue(e.getMessage().contains("width 0"));
    }

    @Test
    void hazardsMustFitInSafeCells() {
        GridConfiguration fits = GridConfiguration.builder()
                .width(4).height(4).mineCount(6).trapCount(5).cursedCount(5)
                .build();
        GridConfiguration overflows = fits.toBuilder().cursedCount(6).build();

        assertTrue(fits.isValid());
        assertFalse(overflows.isValid());
    }

    @Test
    void cellCountDoesNotOverflow() {
        GridConfiguration configuration = GridConfiguration.of(100_000, 100_000, 10);

        assertEquals(10_000_000_000L, configuration.getCellCount());
        assertTrue(configuration.isValid());
    }
}
