package org.angnysa.minequest.grid;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when a {@link GridConfiguration} breaks one or more of its rules.
 * Raised before any cell is allocated.
 */
public class ConfigurationException extends IllegalArgumentException {

    /**
     * Human readable description of every broken rule.
     */
    @Getter private final List<String> violations;

    public ConfigurationException(List<String> violations) {
        super(String.format("Invalid grid configuration: %s", String.join("; ", violations)));
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }
}
