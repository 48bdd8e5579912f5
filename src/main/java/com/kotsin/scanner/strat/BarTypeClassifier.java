package com.kotsin.scanner.strat;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.model.BarType;
import com.kotsin.scanner.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * BarTypeClassifier - Strat bar type of a candle relative to its predecessor.
 *
 * Total for any pair of valid candles:
 * <pre>
 *   high &lt; prevHigh  and low &gt; prevLow    -&gt; 1  (INSIDE)
 *   high == prevHigh and low == prevLow   -&gt; 1  (INSIDE), or 2U when equal-bar-as-inside is off
 *   high &gt; prevHigh  and low &lt; prevLow    -&gt; 3  (OUTSIDE)
 *   high &gt;= prevHigh and low &gt;= prevLow   -&gt; 2U (UP)
 *   low &lt;= prevLow   and high &lt;= prevHigh -&gt; 2D (DOWN)
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class BarTypeClassifier {

    private final ScannerConfigRegistry configRegistry;

    /**
     * @return the bar type, or empty only when there is no previous candle
     */
    public Optional<BarType> classify(Candle prev, Candle curr) {
        if (prev == null || curr == null) {
            return Optional.empty();
        }
        return Optional.of(classify(prev, curr, configRegistry.current().getStrat().isEqualBarAsInside()));
    }

    /**
     * Bar types of every consecutive pair; result has size {@code candles.size() - 1}.
     */
    public List<BarType> classifySeries(List<Candle> candles) {
        boolean equalBarAsInside = configRegistry.current().getStrat().isEqualBarAsInside();
        List<BarType> types = new ArrayList<>(Math.max(0, candles.size() - 1));
        for (int i = 1; i < candles.size(); i++) {
            types.add(classify(candles.get(i - 1), candles.get(i), equalBarAsInside));
        }
        return types;
    }

    static BarType classify(Candle prev, Candle curr, boolean equalBarAsInside) {
        int highComp = Double.compare(curr.getHigh(), prev.getHigh());
        int lowComp = Double.compare(curr.getLow(), prev.getLow());

        if (highComp == 0 && lowComp == 0) {
            return equalBarAsInside ? BarType.INSIDE : BarType.UP;
        }
        if (highComp < 0 && lowComp > 0) {
            return BarType.INSIDE;
        }
        if (highComp > 0 && lowComp < 0) {
            return BarType.OUTSIDE;
        }
        if (highComp >= 0 && lowComp >= 0) {
            return BarType.UP;
        }
        // Remaining: highComp <= 0 and lowComp <= 0
        return BarType.DOWN;
    }
}
