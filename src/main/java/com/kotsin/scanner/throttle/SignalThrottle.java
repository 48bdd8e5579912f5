package com.kotsin.scanner.throttle;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.model.ThrottleState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * SignalThrottle - Per-symbol cooldown and daily signal cap.
 *
 * Stateless itself: the caller owns one ThrottleState per symbol and passes it in. The daily
 * count resets once the next local midnight (configured session zone) has passed.
 */
@Component
@Slf4j
public class SignalThrottle {

    private final ScannerConfigRegistry configRegistry;
    private final Clock clock;

    @Autowired
    public SignalThrottle(ScannerConfigRegistry configRegistry) {
        this(configRegistry, Clock.systemUTC());
    }

    public SignalThrottle(ScannerConfigRegistry configRegistry, Clock clock) {
        this.configRegistry = configRegistry;
        this.clock = clock;
    }

    /**
     * Accept and record a signal for the symbol, or reject it without touching the state.
     */
    public boolean tryAcquire(String symbol, ThrottleState state) {
        ScannerProperties props = configRegistry.current();
        ScannerProperties.Throttle config = props.getThrottle();
        ZoneId zone = ZoneId.of(props.getSession().getZone());
        Instant now = clock.instant();

        rollDay(state, now, zone);

        if (state.getSignalCountToday() >= config.getMaxSignalsPerDay()) {
            log.debug("[THROTTLE] {} rejected: daily cap {} reached", symbol, config.getMaxSignalsPerDay());
            return false;
        }
        Instant last = state.getLastSignalTimestamp();
        if (last != null && Duration.between(last, now).compareTo(config.getCooldown()) < 0) {
            log.debug("[THROTTLE] {} rejected: cooldown {} since {} not elapsed", symbol, config.getCooldown(), last);
            return false;
        }

        state.setSignalCountToday(state.getSignalCountToday() + 1);
        state.setLastSignalTimestamp(now);
        log.debug("[THROTTLE] {} accepted ({}/{} today)", symbol, state.getSignalCountToday(),
                config.getMaxSignalsPerDay());
        return true;
    }

    static void rollDay(ThrottleState state, Instant now, ZoneId zone) {
        if (state.getDayBoundary() == null || !now.isBefore(state.getDayBoundary())) {
            state.setSignalCountToday(0);
            state.setDayBoundary(nextMidnight(now, zone));
        }
    }

    static Instant nextMidnight(Instant now, ZoneId zone) {
        return now.atZone(zone).toLocalDate().plusDays(1).atStartOfDay(zone).toInstant();
    }
}
