package com.kotsin.scanner.harmonic;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.kotsin.scanner.model.AbcdPattern;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * ActivePatternStore - Last signalled ABCD pattern per symbol.
 *
 * Owned by the scan loop, not shared between loops. An entry expires after the configured
 * TTL and is replaced when a newer pattern (later D) is signalled for the same symbol.
 * Used to avoid signalling the same pattern twice.
 */
@Slf4j
public class ActivePatternStore {

    private final Cache<String, AbcdPattern> patterns;

    public ActivePatternStore(Duration ttl) {
        this(ttl, Ticker.systemTicker());
    }

    public ActivePatternStore(Duration ttl, Ticker ticker) {
        this.patterns = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(10_000)
                .ticker(ticker)
                .build();
    }

    /**
     * Store the pattern unless an entry with a later D is already active.
     */
    public void put(AbcdPattern pattern) {
        patterns.asMap().merge(pattern.getSymbol(), pattern, (existing, candidate) ->
                candidate.getD().getTimestamp() >= existing.getD().getTimestamp() ? candidate : existing);
        log.debug("[ABCD] Active pattern for {} D@{}", pattern.getSymbol(), pattern.getD().getTimestamp());
    }

    public Optional<AbcdPattern> get(String symbol) {
        return Optional.ofNullable(patterns.getIfPresent(symbol));
    }

    /**
     * True when this exact pattern (same A and D swing) is the active one for its symbol.
     */
    public boolean isActive(AbcdPattern pattern) {
        AbcdPattern active = patterns.getIfPresent(pattern.getSymbol());
        return active != null
                && active.getA().getTimestamp() == pattern.getA().getTimestamp()
                && active.getD().getTimestamp() == pattern.getD().getTimestamp();
    }

    public Map<String, AbcdPattern> snapshot() {
        return Map.copyOf(patterns.asMap());
    }
}
