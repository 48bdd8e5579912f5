package com.kotsin.scanner.model;

/**
 * PatternFamily - Groups of detectors that a session can switch on or off.
 */
public enum PatternFamily {

    /** 3-bar Strat reversal, breakout and continuation patterns */
    STRAT,

    /** ABCD harmonic patterns */
    HARMONIC,

    /** Premarket gap continuation */
    GAP_CONTINUATION,

    /** Intraday multi-bar momentum continuation */
    MOMENTUM_CONTINUATION,

    /** After-hours wide-range reversal on thin volume */
    THIN_VOLUME_REVERSAL
}
