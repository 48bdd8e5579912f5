package com.kotsin.scanner.confluence;

import com.kotsin.scanner.config.ProcessingConstants;
import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.model.ConfluenceFactor;
import com.kotsin.scanner.model.ConfluenceResult;
import com.kotsin.scanner.model.FactorResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ConfluenceScorer - Runs every factor evaluator against a candidate and aggregates the result.
 *
 * Features:
 * - Weights from the active configuration snapshot
 * - Weighted score = sum of weight x 10 over passed factors, capped at 100
 * - Eligibility needs BOTH the factor count and the score floor
 * - A factor that throws is recorded as failed
 * - Per-factor pass statistics
 */
@Component
@Slf4j
public class ConfluenceScorer {

    private final List<ConfluenceFactorEvaluator> evaluators;
    private final ScannerConfigRegistry configRegistry;
    private final Map<ConfluenceFactor, FactorStats> factorStats = new ConcurrentHashMap<>();

    public ConfluenceScorer(List<ConfluenceFactorEvaluator> evaluators, ScannerConfigRegistry configRegistry) {
        this.evaluators = new ArrayList<>(evaluators);
        this.evaluators.sort(Comparator.comparing(ConfluenceFactorEvaluator::getFactor));
        this.configRegistry = configRegistry;

        log.info("[CONFLUENCE] Scorer initialized with {} factors: {}",
                this.evaluators.size(), this.evaluators.stream().map(ConfluenceFactorEvaluator::getFactor).toList());
    }

    public ConfluenceResult score(ConfluenceContext context) {
        ScannerProperties.Confluence config = configRegistry.current().getConfluence();
        List<FactorResult> breakdown = new ArrayList<>();
        int satisfied = 0;
        double score = 0;

        for (ConfluenceFactorEvaluator evaluator : evaluators) {
            FactorResult result;
            try {
                result = evaluator.evaluate(context);
            } catch (Exception e) {
                log.error("[CONFLUENCE] Factor {} threw exception: {}", evaluator.getFactor(), e.getMessage());
                result = FactorResult.fail(evaluator.getFactor(), "Factor error: " + e.getMessage());
            }
            result.setWeight(config.getWeights().weightOf(evaluator.getFactor()));
            breakdown.add(result);
            factorStats.computeIfAbsent(evaluator.getFactor(), f -> new FactorStats()).record(result.isPassed());

            if (result.isPassed()) {
                satisfied++;
                score += result.getPoints();
            }
        }

        score = Math.min(score, ProcessingConstants.MAX_SCORE);
        boolean eligible = satisfied >= config.getMinConfluence() && score >= config.getMinWeightedScore();

        ConfluenceResult result = ConfluenceResult.builder()
                .satisfiedCount(satisfied)
                .weightedScore(score)
                .breakdown(breakdown)
                .minimumRequired(config.getMinConfluence())
                .minimumScore(config.getMinWeightedScore())
                .eligible(eligible)
                .build();

        if (log.isDebugEnabled()) {
            log.debug("[CONFLUENCE] {} {} {}", context.getCandidate().getSymbol(),
                    context.getCandidate().getLabel(), result.toLogString());
            breakdown.forEach(r -> log.debug("[CONFLUENCE]   {}", r.toLogString()));
        }
        return result;
    }

    public FactorStats getFactorStats(ConfluenceFactor factor) {
        return factorStats.get(factor);
    }

    public List<ConfluenceFactor> getFactors() {
        return evaluators.stream().map(ConfluenceFactorEvaluator::getFactor).toList();
    }

    /**
     * Pass/fail counters for one factor.
     */
    public static class FactorStats {
        private final AtomicLong passed = new AtomicLong();
        private final AtomicLong failed = new AtomicLong();

        void record(boolean pass) {
            (pass ? passed : failed).incrementAndGet();
        }

        public long getPassed() {
            return passed.get();
        }

        public long getFailed() {
            return failed.get();
        }

        public double getPassRate() {
            long total = passed.get() + failed.get();
            return total == 0 ? 0 : (double) passed.get() / total;
        }
    }
}
