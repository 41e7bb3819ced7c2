package com.atcascade.core.engine;

import com.atcascade.core.ConfigurationException;

/**
 * How the engine fits a job: {@code both} optimises fixed and random effects
 * together, {@code fixed} only the fixed effects.
 */
public enum FitMode {
    BOTH("both"),
    FIXED("fixed");

    private final String label;

    FitMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static FitMode fromLabel(String label) {
        for (FitMode mode : values()) {
            if (mode.label.equalsIgnoreCase(label.trim())) {
                return mode;
            }
        }
        throw new ConfigurationException("unknown fit type '" + label + "', expected both or fixed");
    }
}
