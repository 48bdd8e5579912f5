package com.kotsin.scanner.model;

import java.util.List;

/**
 * Fibonacci extension targets of an ABCD pattern, projected from point C.
 *
 * @param base   projected D for the selected extension level
 * @param ext127 127.2% of the projected CD leg
 * @param ext161 161.8% of the projected CD leg
 * @param ext200 200% of the projected CD leg
 * @param ext261 261.8% of the projected CD leg
 */
public record FibonacciTargets(double base, double ext127, double ext161, double ext200, double ext261) {

    /**
     * The four levels D is tested against; base is not one of them.
     */
    public List<Double> extensions() {
        return List.of(ext127, ext161, ext200, ext261);
    }
}
