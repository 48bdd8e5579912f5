package com.kotsin.scanner.account;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.model.AccountContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Account figures from {@code scanner.risk.account.*}. Replace with a broker-backed bean to size
 * against live equity.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredAccountContextProvider implements AccountContextProvider {

    private final ScannerConfigRegistry configRegistry;

    @Override
    public AccountContext getAccountContext() {
        ScannerProperties.Account account = configRegistry.current().getRisk().getAccount();
        return AccountContext.builder()
                .equity(account.getEquity())
                .maxRiskFraction(account.getMaxRiskFraction())
                .maxPositionFraction(account.getMaxPositionFraction())
                .build();
    }
}
