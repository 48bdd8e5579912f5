package com.kotsin.scanner.model;

/**
 * BarType - Strat classification of a candle relative to the one before it.
 */
public enum BarType {

    INSIDE("1"),
    UP("2U"),
    DOWN("2D"),
    OUTSIDE("3");

    private final String label;

    BarType(String label) {
        this.label = label;
    }

    /**
     * Strat notation ("1", "2U", "2D", "3").
     */
    public String getLabel() {
        return label;
    }
}
