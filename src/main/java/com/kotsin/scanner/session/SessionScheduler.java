package com.kotsin.scanner.session;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.model.MarketSession;
import com.kotsin.scanner.model.PatternFamily;
import com.kotsin.scanner.model.SessionInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;

/**
 * SessionScheduler - Maps wall-clock time to the market session and its parameters.
 *
 * Windows in the configured zone (America/New_York by default), each half-open:
 * - PREMARKET  [04:00, 09:30)
 * - INTRADAY   [09:30, 16:00)
 * - AFTERHOURS [16:00, 20:00)
 * - CLOSED     otherwise
 *
 * Stateless: every call classifies from scratch against the current configuration.
 */
@Component
@Slf4j
public class SessionScheduler {

    private final ScannerConfigRegistry configRegistry;
    private final Clock clock;

    @Autowired
    public SessionScheduler(ScannerConfigRegistry configRegistry) {
        this(configRegistry, Clock.systemUTC());
    }

    SessionScheduler(ScannerConfigRegistry configRegistry, Clock clock) {
        this.configRegistry = configRegistry;
        this.clock = clock;
    }

    public SessionInfo current() {
        return classify(clock.instant());
    }

    public SessionInfo classify(Instant instant) {
        ScannerProperties.Sessions config = configRegistry.current().getSession();
        LocalTime time = instant.atZone(ZoneId.of(config.getZone())).toLocalTime();

        MarketSession session = sessionAt(time, config);
        ScannerProperties.SessionParameters params = parametersFor(session, config);

        return SessionInfo.builder()
                .session(session)
                .localTime(time)
                .scanInterval(params.getScanInterval())
                .riskMultiplier(params.getRiskMultiplier())
                .apiBudgetPerMinute(params.getApiBudgetPerMinute())
                .enabledPatternFamilies(params.getPatternFamilies().isEmpty()
                        ? EnumSet.noneOf(PatternFamily.class)
                        : EnumSet.copyOf(params.getPatternFamilies()))
                .build();
    }

    static MarketSession sessionAt(LocalTime time, ScannerProperties.Sessions config) {
        if (!time.isBefore(config.getPremarketStart()) && time.isBefore(config.getIntradayStart())) {
            return MarketSession.PREMARKET;
        }
        if (!time.isBefore(config.getIntradayStart()) && time.isBefore(config.getAfterhoursStart())) {
            return MarketSession.INTRADAY;
        }
        if (!time.isBefore(config.getAfterhoursStart()) && time.isBefore(config.getAfterhoursEnd())) {
            return MarketSession.AFTERHOURS;
        }
        return MarketSession.CLOSED;
    }

    private static ScannerProperties.SessionParameters parametersFor(MarketSession session,
                                                                     ScannerProperties.Sessions config) {
        return switch (session) {
            case PREMARKET -> config.getPremarket();
            case INTRADAY -> config.getIntraday();
            case AFTERHOURS -> config.getAfterhours();
            case CLOSED -> config.getClosed();
        };
    }
}
