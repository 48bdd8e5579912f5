package com.kotsin.scanner.risk;

/**
 * Where the protective stop is placed relative to a candidate.
 */
public enum StopPolicy {

    /**
     * Beyond the pattern's structural anchor by a fixed fraction of the anchor price.
     */
    ANCHOR,

    /**
     * A multiple of ATR away from entry; falls back to the pattern range when ATR is unavailable.
     */
    ATR
}
