package com.kotsin.scanner.scan;

import com.kotsin.scanner.account.AccountContextProvider;
import com.kotsin.scanner.confluence.ConfluenceContext;
import com.kotsin.scanner.confluence.ConfluenceScorer;
import com.kotsin.scanner.harmonic.AbcdPatternDetector;
import com.kotsin.scanner.harmonic.ActivePatternStore;
import com.kotsin.scanner.indicator.IndicatorGateway;
import com.kotsin.scanner.model.AbcdPattern;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.CandleValidationResult;
import com.kotsin.scanner.model.ConfluenceResult;
import com.kotsin.scanner.model.FactorResult;
import com.kotsin.scanner.model.IndicatorSnapshot;
import com.kotsin.scanner.model.PatternCandidate;
import com.kotsin.scanner.model.PatternFamily;
import com.kotsin.scanner.model.RawCandle;
import com.kotsin.scanner.model.SessionInfo;
import com.kotsin.scanner.model.SymbolHistory;
import com.kotsin.scanner.model.TechnicalPattern;
import com.kotsin.scanner.model.TradeSignal;
import com.kotsin.scanner.risk.TradeLevelCalculator;
import com.kotsin.scanner.risk.TradeLevels;
import com.kotsin.scanner.session.SessionPatternDetector;
import com.kotsin.scanner.strat.StratPatternRecognizer;
import com.kotsin.scanner.technical.TechnicalPatternDetector;
import com.kotsin.scanner.throttle.SignalThrottle;
import com.kotsin.scanner.validation.CandleValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * SymbolScanner - One symbol's pass through the pipeline.
 *
 * <pre>
 *   raw candles -> validator -> history
 *   snapshot -> {Strat, ABCD, session families} -> candidates
 *   candidates -> confluence (indicators fetched once) -> eligible
 *   eligible -> trade levels -> throttle -> TradeSignal
 * </pre>
 *
 * Holds no per-symbol state of its own; everything lives in the SymbolScanState passed in.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SymbolScanner {

    private final CandleValidator candleValidator;
    private final StratPatternRecognizer stratRecognizer;
    private final AbcdPatternDetector abcdDetector;
    private final SessionPatternDetector sessionPatternDetector;
    private final TechnicalPatternDetector technicalPatternDetector;
    private final IndicatorGateway indicatorGateway;
    private final ConfluenceScorer confluenceScorer;
    private final TradeLevelCalculator tradeLevelCalculator;
    private final SignalThrottle signalThrottle;
    private final AccountContextProvider accountContextProvider;

    /**
     * Validate and append queued candles in arrival order.
     *
     * @return number of candles appended
     */
    public int ingest(SymbolScanState state, List<RawCandle> raws) {
        SymbolHistory history = state.getHistory();
        int appended = 0;
        for (RawCandle raw : raws) {
            if (raw.getInterval() == null) {
                raw.setInterval(history.getInterval());
            } else if (!raw.getInterval().equals(history.getInterval())) {
                log.debug("[SCAN] {} ignoring {} candle, scanning {}", state.getSymbol(), raw.getInterval(),
                        history.getInterval());
                continue;
            }
            CandleValidationResult result = candleValidator.validate(raw, history.lastTimestamp());
            if (result.isAccepted()) {
                history.append(result.getCandle());
                appended++;
            } else {
                log.debug("[SCAN] {} candle rejected: {}", state.getSymbol(), result.toLogString());
            }
        }
        return appended;
    }

    /**
     * Scan the symbol's current window. Returns the signals that passed every stage.
     */
    public List<TradeSignal> scan(SymbolScanState state, SessionInfo session, ActivePatternStore activePatterns) {
        SymbolHistory history = state.getHistory();
        if (session.getEnabledPatternFamilies().isEmpty() || history.size() < 3) {
            return List.of();
        }
        Long latestTimestamp = history.lastTimestamp();
        if (latestTimestamp.equals(state.getLastScannedTimestamp())) {
            log.trace("[SCAN] {} no new bar since last scan", state.getSymbol());
            return List.of();
        }
        state.setLastScannedTimestamp(latestTimestamp);

        List<Candle> snapshot = history.snapshot();
        Candle latest = snapshot.get(snapshot.size() - 1);

        List<TechnicalPattern> technicalPatterns = technicalPatternDetector.detect(snapshot);
        if (!technicalPatterns.isEmpty()) {
            state.setLastTechnicalPattern(technicalPatterns.get(technicalPatterns.size() - 1));
        }

        List<PatternCandidate> candidates = detectCandidates(snapshot, session, activePatterns);
        if (candidates.isEmpty()) {
            return List.of();
        }

        IndicatorSnapshot indicators = indicatorGateway.fetch(state.getSymbol(), history.getInterval(), snapshot)
                .orElse(null);

        List<ScoredCandidate> eligible = new ArrayList<>();
        for (PatternCandidate candidate : candidates) {
            ConfluenceResult confluence = confluenceScorer.score(
                    ConfluenceContext.of(candidate, snapshot, indicators, technicalPatterns));
            qualify(candidate, confluence, latest, activePatterns).ifPresent(eligible::add);
        }
        eligible.sort(Comparator.comparingDouble((ScoredCandidate s) -> s.confluence().getWeightedScore())
                .thenComparingDouble(s -> s.candidate().getStrength())
                .reversed());

        List<TradeSignal> signals = new ArrayList<>();
        for (ScoredCandidate scored : eligible) {
            toSignal(state, scored, indicators, session, technicalPatterns, snapshot.size())
                    .ifPresent(signals::add);
        }
        return signals;
    }

    private List<PatternCandidate> detectCandidates(List<Candle> snapshot, SessionInfo session,
                                                    ActivePatternStore activePatterns) {
        List<PatternCandidate> candidates = new ArrayList<>();
        Candle latest = snapshot.get(snapshot.size() - 1);

        if (session.isFamilyEnabled(PatternFamily.STRAT)) {
            stratRecognizer.recognize(snapshot)
                    .map(stratRecognizer::toCandidate)
                    .ifPresent(candidates::add);
        }
        if (session.isFamilyEnabled(PatternFamily.HARMONIC)) {
            for (AbcdPattern pattern : abcdDetector.findPatterns(snapshot)) {
                if (activePatterns.isActive(pattern)) {
                    log.debug("[ABCD] {} {} already active, skipping", pattern.getSymbol(), pattern.getLabel());
                    continue;
                }
                candidates.add(abcdDetector.toCandidate(pattern, latest));
            }
        }
        candidates.addAll(sessionPatternDetector.detect(snapshot, session));
        return candidates;
    }

    /**
     * Eligibility per family. ABCD patterns also need the strength floor and price near D,
     * and are recorded as active once they qualify.
     */
    private Optional<ScoredCandidate> qualify(PatternCandidate candidate, ConfluenceResult confluence,
                                              Candle latest, ActivePatternStore activePatterns) {
        if (candidate.getFamily() != PatternFamily.HARMONIC) {
            if (!confluence.isEligible()) {
                log.debug("[SCAN] {} {} not eligible: {}", candidate.getSymbol(), candidate.getLabel(),
                        confluence.toLogString());
                return Optional.empty();
            }
            return Optional.of(new ScoredCandidate(candidate, confluence));
        }

        AbcdPattern scored = abcdDetector.applyConfluence(candidate.getAbcdPattern(), confluence);
        if (!abcdDetector.isSignalEligible(scored, confluence)) {
            log.debug("[ABCD] {} {} not eligible: strength={} {}", scored.getSymbol(), scored.getLabel(),
                    scored.getStrength(), confluence.toLogString());
            return Optional.empty();
        }
        if (!abcdDetector.isTradeable(scored, latest)) {
            log.debug("[ABCD] {} {} not tradeable at close {}", scored.getSymbol(), scored.getLabel(),
                    latest.getClose());
            return Optional.empty();
        }
        activePatterns.put(scored);
        return Optional.of(new ScoredCandidate(abcdDetector.toCandidate(scored, latest), confluence));
    }

    private Optional<TradeSignal> toSignal(SymbolScanState state, ScoredCandidate scored,
                                           IndicatorSnapshot indicators, SessionInfo session,
                                           List<TechnicalPattern> technicalPatterns, int snapshotSize) {
        PatternCandidate candidate = scored.candidate();
        ConfluenceResult confluence = scored.confluence();

        Optional<TradeLevels> levels = tradeLevelCalculator.calculate(candidate, indicators,
                accountContextProvider.getAccountContext(), session);
        if (levels.isEmpty()) {
            return Optional.empty();
        }
        if (!signalThrottle.tryAcquire(candidate.getSymbol(), state.getThrottleState())) {
            return Optional.empty();
        }

        double confidence = tradeLevelCalculator.confidence(confluence, candidate.getDirection(),
                technicalPatterns, snapshotSize);
        TradeLevels l = levels.get();

        TradeSignal signal = TradeSignal.builder()
                .signalId(UUID.randomUUID().toString())
                .symbol(candidate.getSymbol())
                .interval(candidate.getInterval())
                .direction(candidate.getDirection().toTradeDirection())
                .confidence(confidence)
                .entryPrice(l.getEntryPrice())
                .stopLoss(l.getStopLoss())
                .takeProfit(l.getTakeProfit())
                .positionSize(l.getPositionSize())
                .riskRewardRatio(l.getRiskRewardRatio())
                .patternLabel(candidate.getLabel())
                .family(candidate.getFamily())
                .session(session.getSession())
                .confluenceCount(confluence.getSatisfiedCount())
                .confluenceScore(confluence.getWeightedScore())
                .reasoning(reasoning(candidate, confluence, session))
                .timestamp(Instant.now())
                .build();

        log.info("[SCAN] SIGNAL {} {} {} entry={} stop={} target={} size={} confidence={} ({})",
                signal.getSymbol(), signal.getDirection(), signal.getPatternLabel(),
                String.format("%.2f", signal.getEntryPrice()), String.format("%.2f", signal.getStopLoss()),
                String.format("%.2f", signal.getTakeProfit()), String.format("%.2f", signal.getPositionSize()),
                String.format("%.2f", signal.getConfidence()), confluence.toLogString());
        return Optional.of(signal);
    }

    static String reasoning(PatternCandidate candidate, ConfluenceResult confluence, SessionInfo session) {
        String factors = confluence.getBreakdown().stream()
                .filter(FactorResult::isPassed)
                .map(r -> r.getFactor().name())
                .collect(Collectors.joining(", "));
        return String.format("%s %s %s in %s; confluence %d/%d (score %.0f): %s",
                candidate.getFamily(), candidate.getLabel(), candidate.getDirection(), session.getSession(),
                confluence.getSatisfiedCount(), confluence.getBreakdown().size(), confluence.getWeightedScore(),
                factors);
    }

    record ScoredCandidate(PatternCandidate candidate, ConfluenceResult confluence) {
    }
}
