package com.kotsin.scanner.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Set;

/**
 * SessionInfo - Immutable session classification with its scan and risk parameters.
 *
 * Recomputed from wall-clock time on every scan tick; replaced, never mutated.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SessionInfo {

    private final MarketSession session;
    private final LocalTime localTime;
    private final Duration scanInterval;
    private final double riskMultiplier;
    private final int apiBudgetPerMinute;
    private final Set<PatternFamily> enabledPatternFamilies;

    public boolean isFamilyEnabled(PatternFamily family) {
        return enabledPatternFamilies != null && enabledPatternFamilies.contains(family);
    }
}
