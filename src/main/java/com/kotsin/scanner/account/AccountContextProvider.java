package com.kotsin.scanner.account;

import com.kotsin.scanner.model.AccountContext;

/**
 * Supplies equity and risk limits for position sizing.
 */
public interface AccountContextProvider {

    AccountContext getAccountContext();
}
