package com.kotsin.scanner.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ScannerConfigRegistry - Holds the active scanner configuration snapshot.
 *
 * The snapshot bound at startup is validated in the constructor, so an invalid
 * configuration stops the application before the first tick. Components read
 * {@link #current()} once per operation and never cache it across ticks, which
 * makes {@link #reload} effective from the next tick on.
 *
 * A reload candidate is validated first; if it has errors it is rejected and the
 * previous snapshot stays active.
 */
@Component
@Slf4j
public class ScannerConfigRegistry {

    private final ConfigurationValidator validator;
    private final AtomicReference<ScannerProperties> active = new AtomicReference<>();
    private final AtomicLong version = new AtomicLong(0);
    private volatile Instant loadedAt;

    public ScannerConfigRegistry(ScannerProperties initial, ConfigurationValidator validator) {
        this.validator = validator;
        validator.validateOrThrow(initial);
        install(initial);
        logConfigurationSummary(initial);
    }

    public ScannerProperties current() {
        return active.get();
    }

    /**
     * Validate and swap in a new configuration.
     *
     * @return true if the candidate was installed, false if it was rejected
     */
    public boolean reload(ScannerProperties candidate) {
        List<String> errors = validator.validate(candidate);
        if (!errors.isEmpty()) {
            log.error("[CONFIG] Reload rejected, keeping version {}. {} errors: {}",
                    version.get(), errors.size(), errors);
            return false;
        }
        install(candidate);
        log.info("[CONFIG] Reloaded configuration, now version {}", version.get());
        return true;
    }

    public long getVersion() {
        return version.get();
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    private void install(ScannerProperties props) {
        active.set(props);
        version.incrementAndGet();
        loadedAt = Instant.now();
    }

    private void logConfigurationSummary(ScannerProperties props) {
        log.info("[CONFIG] Configuration Summary:");
        log.info("  Watchlist: {} @ {}", props.getWatchlist().getSymbols(), props.getWatchlist().getInterval());
        log.info("  History: maxLength={}, minBarRange={}",
                props.getHistory().getMaxLength(), props.getHistory().getMinBarRange());
        log.info("  Confluence: min={}, minScore={}, fibTolerance={}",
                props.getConfluence().getMinConfluence(), props.getConfluence().getMinWeightedScore(),
                props.getConfluence().getFibTolerance());
        log.info("  Risk: policy={}, maxRisk={}, equity={}", props.getRisk().getStopPolicy(),
                props.getRisk().getAccount().getMaxRiskFraction(), props.getRisk().getAccount().getEquity());
        log.info("  Throttle: maxPerDay={}, cooldown={}",
                props.getThrottle().getMaxSignalsPerDay(), props.getThrottle().getCooldown());
        log.info("  Session zone: {}", props.getSession().getZone());
    }
}
