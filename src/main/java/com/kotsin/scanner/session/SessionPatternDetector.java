package com.kotsin.scanner.session;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.indicator.HistoryIndicatorProvider;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.PatternCandidate;
import com.kotsin.scanner.model.PatternFamily;
import com.kotsin.scanner.model.SessionInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SessionPatternDetector - Pattern families that only run in specific sessions.
 *
 * - GAP_CONTINUATION (premarket): open gaps past the previous close and the bar closes with the gap
 * - MOMENTUM_CONTINUATION (intraday): most of the recent bars close in one direction, last bar included
 * - THIN_VOLUME_REVERSAL (after hours): wide bar on below-average volume
 *
 * Candidates enter at the last close with the stop anchored on the last bar's extreme.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionPatternDetector {

    private final ScannerConfigRegistry configRegistry;

    public List<PatternCandidate> detect(List<Candle> snapshot, SessionInfo session) {
        List<PatternCandidate> candidates = new ArrayList<>();
        if (snapshot.size() < 2) {
            return candidates;
        }
        ScannerProperties props = configRegistry.current();

        if (session.isFamilyEnabled(PatternFamily.GAP_CONTINUATION)) {
            gapContinuation(snapshot, props.getSession()).ifPresent(candidates::add);
        }
        if (session.isFamilyEnabled(PatternFamily.MOMENTUM_CONTINUATION)) {
            momentumContinuation(snapshot, props.getSession()).ifPresent(candidates::add);
        }
        if (session.isFamilyEnabled(PatternFamily.THIN_VOLUME_REVERSAL)) {
            thinVolumeReversal(snapshot, props.getSession(), props.getIndicator().getVolumeSmaPeriod())
                    .ifPresent(candidates::add);
        }

        if (!candidates.isEmpty()) {
            log.debug("[SESSION] {} {} candidates in {}: {}", last(snapshot).getSymbol(), candidates.size(),
                    session.getSession(), candidates.stream().map(PatternCandidate::getLabel).toList());
        }
        return candidates;
    }

    Optional<PatternCandidate> gapContinuation(List<Candle> snapshot, ScannerProperties.Sessions config) {
        Candle last = last(snapshot);
        Candle prev = snapshot.get(snapshot.size() - 2);
        double threshold = config.getGapThreshold();

        if (last.getOpen() > prev.getClose() * (1 + threshold) && last.getClose() > last.getOpen()) {
            return Optional.of(candidate(last, PatternFamily.GAP_CONTINUATION, "GAP_UP", Direction.BULLISH, config));
        }
        if (last.getOpen() < prev.getClose() * (1 - threshold) && last.getClose() < last.getOpen()) {
            return Optional.of(candidate(last, PatternFamily.GAP_CONTINUATION, "GAP_DOWN", Direction.BEARISH, config));
        }
        return Optional.empty();
    }

    Optional<PatternCandidate> momentumContinuation(List<Candle> snapshot, ScannerProperties.Sessions config) {
        int bars = config.getMomentumBars();
        if (snapshot.size() < bars) {
            return Optional.empty();
        }
        List<Candle> window = snapshot.subList(snapshot.size() - bars, snapshot.size());
        long up = window.stream().filter(Candle::isBullish).count();
        long down = window.stream().filter(Candle::isBearish).count();
        Candle last = last(snapshot);

        if (up >= config.getMomentumMinBars() && last.isBullish()) {
            return Optional.of(candidate(last, PatternFamily.MOMENTUM_CONTINUATION, "MOMENTUM_UP",
                    Direction.BULLISH, config));
        }
        if (down >= config.getMomentumMinBars() && last.isBearish()) {
            return Optional.of(candidate(last, PatternFamily.MOMENTUM_CONTINUATION, "MOMENTUM_DOWN",
                    Direction.BEARISH, config));
        }
        return Optional.empty();
    }

    Optional<PatternCandidate> thinVolumeReversal(List<Candle> snapshot, ScannerProperties.Sessions config,
                                                  int volumeSmaPeriod) {
        Candle last = last(snapshot);
        Candle prev = snapshot.get(snapshot.size() - 2);
        Double averageVolume = HistoryIndicatorProvider.volumeSma(snapshot, volumeSmaPeriod);
        if (averageVolume == null || !last.hasVolume()) {
            return Optional.empty();
        }
        if (last.getRange() > prev.getRange() * config.getReversalRangeRatio() && last.getVolume() < averageVolume) {
            Direction direction = last.getClose() > last.getOpen() ? Direction.BULLISH : Direction.BEARISH;
            String label = direction == Direction.BULLISH ? "THIN_VOLUME_REVERSAL_UP" : "THIN_VOLUME_REVERSAL_DOWN";
            return Optional.of(candidate(last, PatternFamily.THIN_VOLUME_REVERSAL, label, direction, config));
        }
        return Optional.empty();
    }

    private static PatternCandidate candidate(Candle last, PatternFamily family, String label, Direction direction,
                                              ScannerProperties.Sessions config) {
        return PatternCandidate.builder()
                .symbol(last.getSymbol())
                .interval(last.getInterval())
                .family(family)
                .label(label)
                .direction(direction)
                .entryPrice(last.getClose())
                .anchorPrice(direction == Direction.BULLISH ? last.getLow() : last.getHigh())
                .referencePrice(last.getClose())
                .patternRange(last.getRange())
                .strength(config.getFamilyBaseStrength())
                .rewardMultiplier(config.getRewardMultiplier())
                .timestamp(last.getTimestamp())
                .build();
    }

    private static Candle last(List<Candle> snapshot) {
        return snapshot.get(snapshot.size() - 1);
    }
}
