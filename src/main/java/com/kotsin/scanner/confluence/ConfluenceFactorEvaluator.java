package com.kotsin.scanner.confluence;

import com.kotsin.scanner.model.ConfluenceFactor;
import com.kotsin.scanner.model.FactorResult;

/**
 * ConfluenceFactorEvaluator - One independent confirmation check.
 *
 * Each evaluator covers a single factor:
 * - Fibonacci alignment
 * - EMA trend alignment
 * - Volume expansion
 * - Technical pattern agreement
 * - RSI zone
 * - MACD momentum
 *
 * Weights are applied by the scorer from configuration; evaluators only decide pass or fail.
 */
public interface ConfluenceFactorEvaluator {

    ConfluenceFactor getFactor();

    /**
     * Evaluate the candidate. Missing inputs are a fail, never a pass.
     */
    FactorResult evaluate(ConfluenceContext context);
}
