package com.kotsin.scanner.confluence.impl;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.confluence.ConfluenceContext;
import com.kotsin.scanner.confluence.ConfluenceFactorEvaluator;
import com.kotsin.scanner.indicator.HistoryIndicatorProvider;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.ConfluenceFactor;
import com.kotsin.scanner.model.FactorResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * VolumeFactor - Volume of the candidate bar expands over the average of the bars before it.
 *
 * The indicator snapshot average ends before the latest bar. When the candidate is judged at an
 * earlier bar (ABCD point D) the average is recomputed over the bars before that one.
 */
@Component
@RequiredArgsConstructor
public class VolumeFactor implements ConfluenceFactorEvaluator {

    private final ScannerConfigRegistry configRegistry;

    @Override
    public ConfluenceFactor getFactor() {
        return ConfluenceFactor.VOLUME;
    }

    @Override
    public FactorResult evaluate(ConfluenceContext context) {
        Candle candle = context.getCandidateCandle();
        Double average = volumeAverage(context);
        if (average == null || !candle.hasVolume()) {
            return FactorResult.fail(getFactor(), "Volume data not available");
        }
        if (average <= 0) {
            return FactorResult.fail(getFactor(), "Zero average volume");
        }
        double multiplier = configRegistry.current().getConfluence().getVolumeMultiplier();
        double ratio = candle.getVolume() / average;
        if (ratio > multiplier) {
            return FactorResult.pass(getFactor(), String.format("Volume %.1fx average", ratio));
        }
        return FactorResult.fail(getFactor(), String.format("Volume too low: %.1fx (need > %.1fx)", ratio, multiplier));
    }

    private Double volumeAverage(ConfluenceContext context) {
        int index = context.getCandidateIndex();
        if (index == context.getSnapshot().size() - 1) {
            return context.hasIndicators() ? context.getIndicators().getVolumeSma() : null;
        }
        int period = configRegistry.current().getIndicator().getVolumeSmaPeriod();
        return HistoryIndicatorProvider.volumeSma(context.getSnapshot().subList(0, index + 1), period);
    }
}
