package com.kotsin.scanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AccountContext - Equity and risk limits supplied by the account collaborator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountContext {

    private double equity;
    private double maxRiskFraction;         // e.g. 0.02 = 2% of equity at risk per trade
    private double maxPositionFraction;     // cap on notional position as a fraction of equity
}
