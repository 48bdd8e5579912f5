package com.kotsin.scanner.config;

import com.kotsin.scanner.model.ConfluenceFactor;
import com.kotsin.scanner.model.PatternFamily;
import com.kotsin.scanner.risk.StopPolicy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Scanner Configuration - All tunable parameters of the pattern scanner.
 *
 * Properties can be overridden via application.yml:
 * scanner:
 *   harmonic:
 *     fib-tolerance: 0.02
 *   confluence:
 *     min-confluence: 4
 *   ...
 *
 * The bound instance is validated once at startup by ScannerConfigRegistry. Later
 * reloads go through ScannerConfigRegistry.reload, never through this bean directly.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scanner")
public class ScannerProperties {

    private Watchlist watchlist = new Watchlist();
    private History history = new History();
    private Strat strat = new Strat();
    private Harmonic harmonic = new Harmonic();
    private Confluence confluence = new Confluence();
    private Sessions session = new Sessions();
    private Risk risk = new Risk();
    private Throttle throttle = new Throttle();
    private Indicator indicator = new Indicator();

    // ========== Watchlist ==========

    @Data
    public static class Watchlist {
        private List<String> symbols = new ArrayList<>(List.of("SPY", "QQQ", "AAPL", "MSFT", "NVDA"));

        /**
         * Bar interval scanned for every symbol
         */
        private String interval = "5m";
    }

    // ========== History ==========

    @Data
    public static class History {
        /**
         * Sliding window length per symbol; oldest candles are evicted beyond this
         */
        private int maxLength = 200;

        /**
         * Bars with a smaller high-low range are treated as noise and rejected
         */
        private double minBarRange = 0.01;
    }

    // ========== Strat ==========

    @Data
    public static class Strat {
        /**
         * Classify a bar with exactly equal high and low as INSIDE (otherwise UP)
         */
        private boolean equalBarAsInside = true;

        /**
         * Patterns below this raw strength are discarded
         */
        private double minStrength = 40;

        private double rewardMultiplier = 2.0;

        /**
         * Stop offset beyond the bar2/bar3 extreme, as a fraction of bar3's range
         */
        private double stopRangeFraction = 0.1;
    }

    // ========== Harmonic (ABCD) ==========

    @Data
    public static class Harmonic {
        /**
         * Bars on each side that a swing must dominate
         */
        private int swingLookback = 5;

        /**
         * Minimum candles before swings are extracted
         */
        private int minHistory = 50;

        /**
         * Most recent 4-swing groups examined per scan
         */
        private int maxGroups = 20;

        /**
         * Minimum AB and CD leg as a fraction of A's price (0.005 = 0.5%)
         */
        private double minSwingSize = 0.005;

        private double bcRetracementMin = 0.382;
        private double bcRetracementMax = 0.886;
        private double abcdRatioMin = 0.618;
        private double abcdRatioMax = 1.618;

        /**
         * Strength floor for a signal-eligible pattern
         */
        private double minStrength = 70;

        /**
         * Strength is min(strengthCap, weighted confluence score)
         */
        private double strengthCap = 95;

        /**
         * Latest candle must be within this age of point D
         */
        private Duration maxPatternAge = Duration.ofHours(24);

        private Duration activePatternTtl = Duration.ofHours(24);

        private double rewardMultiplier = 1.5;
    }

    // ========== Confluence ==========

    @Data
    public static class Confluence {
        /**
         * Satisfied factors required for eligibility
         */
        private int minConfluence = 4;

        /**
         * Weighted score floor (0-100) required for eligibility
         */
        private double minWeightedScore = 50;

        private Weights weights = new Weights();

        /**
         * Price proximity to a Fibonacci level, as a fraction of price
         */
        private double fibTolerance = 0.02;

        /**
         * EMA ladder checked for trend alignment, fastest first
         */
        private List<Integer> emaPeriods = new ArrayList<>(List.of(20, 50, 100));

        private double volumeMultiplier = 1.2;

        private double rsiOversold = 30;
        private double rsiOverbought = 70;
        private double rsiNeutralLow = 40;
        private double rsiNeutralHigh = 60;

        /**
         * Bars considered when looking for a Fibonacci swing range for non-harmonic candidates
         */
        private int fibSwingLookback = 20;
    }

    @Data
    public static class Weights {
        private int fibonacci = ConfluenceFactor.FIBONACCI.getDefaultWeight();
        private int trend = ConfluenceFactor.TREND.getDefaultWeight();
        private int volume = ConfluenceFactor.VOLUME.getDefaultWeight();
        private int technicalPattern = ConfluenceFactor.TECHNICAL_PATTERN.getDefaultWeight();
        private int rsi = ConfluenceFactor.RSI.getDefaultWeight();
        private int macd = ConfluenceFactor.MACD.getDefaultWeight();

        public int weightOf(ConfluenceFactor factor) {
            return switch (factor) {
                case FIBONACCI -> fibonacci;
                case TREND -> trend;
                case VOLUME -> volume;
                case TECHNICAL_PATTERN -> technicalPattern;
                case RSI -> rsi;
                case MACD -> macd;
            };
        }

        public int total() {
            return fibonacci + trend + volume + technicalPattern + rsi + macd;
        }
    }

    // ========== Sessions ==========

    @Data
    public static class Sessions {
        private String zone = "America/New_York";

        private LocalTime premarketStart = LocalTime.of(4, 0);
        private LocalTime intradayStart = LocalTime.of(9, 30);
        private LocalTime afterhoursStart = LocalTime.of(16, 0);
        private LocalTime afterhoursEnd = LocalTime.of(20, 0);

        private SessionParameters premarket = new SessionParameters(Duration.ofMinutes(2), 0.7, 30,
                EnumSet.of(PatternFamily.STRAT, PatternFamily.GAP_CONTINUATION));
        private SessionParameters intraday = new SessionParameters(Duration.ofMinutes(1), 1.0, 60,
                EnumSet.of(PatternFamily.STRAT, PatternFamily.HARMONIC, PatternFamily.MOMENTUM_CONTINUATION));
        private SessionParameters afterhours = new SessionParameters(Duration.ofMinutes(5), 0.5, 15,
                EnumSet.of(PatternFamily.STRAT, PatternFamily.THIN_VOLUME_REVERSAL));
        private SessionParameters closed = new SessionParameters(Duration.ofMinutes(10), 0.3, 5,
                EnumSet.noneOf(PatternFamily.class));

        /**
         * Opening gap vs previous close for gap continuation (0.02 = 2%)
         */
        private double gapThreshold = 0.02;

        /**
         * Momentum continuation: at least momentumMinBars of the last momentumBars close in trend
         */
        private int momentumBars = 5;
        private int momentumMinBars = 3;

        /**
         * Thin-volume reversal: last range must exceed this fraction of the previous range
         */
        private double reversalRangeRatio = 0.5;

        private double familyBaseStrength = 60;
        private double rewardMultiplier = 1.5;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SessionParameters {
        private Duration scanInterval;
        private double riskMultiplier;
        private int apiBudgetPerMinute;
        private Set<PatternFamily> patternFamilies = EnumSet.noneOf(PatternFamily.class);
    }

    // ========== Risk ==========

    @Data
    public static class Risk {
        private StopPolicy stopPolicy = StopPolicy.ANCHOR;

        /**
         * ANCHOR policy: stop placed this fraction of the anchor price beyond the anchor
         */
        private double stopBuffer = 0.005;

        /**
         * ATR policy: stop placed this many ATRs from entry
         */
        private double atrStopMultiplier = 1.5;

        /**
         * Confidence bonus when an independent technical pattern agrees recently
         */
        private double recencyBonus = 0.05;
        private int recencyBars = 3;

        private Account account = new Account();
    }

    @Data
    public static class Account {
        private double equity = 100_000;
        private double maxRiskFraction = 0.02;
        private double maxPositionFraction = 0.10;
    }

    // ========== Throttle ==========

    @Data
    public static class Throttle {
        private int maxSignalsPerDay = 5;
        private Duration cooldown = Duration.ofMinutes(15);
    }

    // ========== Indicator provider resilience ==========

    @Data
    public static class Indicator {
        private int retryAttempts = 2;
        private int circuitFailureThreshold = 5;
        private Duration circuitOpenTimeout = Duration.ofMinutes(1);
        private int circuitHalfOpenCalls = 2;

        /**
         * Longest wait for a rate-limiter permit before the fetch is skipped for this tick
         */
        private Duration permitTimeout = Duration.ofSeconds(2);

        private int rsiPeriod = 14;
        private int macdFast = 12;
        private int macdSlow = 26;
        private int macdSignal = 9;
        private int volumeSmaPeriod = 20;
        private int atrPeriod = 14;
        private int bollingerPeriod = 20;
        private double bollingerStdDev = 2.0;
    }
}
