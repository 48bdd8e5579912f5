package com.kotsin.scanner.confluence;

import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.IndicatorSnapshot;
import com.kotsin.scanner.model.PatternCandidate;
import com.kotsin.scanner.model.TechnicalPattern;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Inputs shared by all confluence factors for one candidate.
 *
 * candidateIndex is the snapshot position of the bar the candidate is judged at
 * (D for an ABCD pattern, the last bar otherwise).
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConfluenceContext {

    private final PatternCandidate candidate;
    private final List<Candle> snapshot;
    private final int candidateIndex;
    private final IndicatorSnapshot indicators;     // null when the provider was unavailable
    private final List<TechnicalPattern> technicalPatterns;

    public static ConfluenceContext of(PatternCandidate candidate, List<Candle> snapshot,
                                       IndicatorSnapshot indicators, List<TechnicalPattern> technicalPatterns) {
        int index = snapshot.size() - 1;
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            if (snapshot.get(i).getTimestamp() == candidate.getTimestamp()) {
                index = i;
                break;
            }
        }
        return new ConfluenceContext(candidate, snapshot, index, indicators,
                technicalPatterns != null ? technicalPatterns : List.of());
    }

    public Candle getCandidateCandle() {
        return snapshot.get(candidateIndex);
    }

    public boolean hasIndicators() {
        return indicators != null;
    }
}
