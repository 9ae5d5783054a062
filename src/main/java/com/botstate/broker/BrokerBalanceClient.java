package com.botstate.broker;

import com.botstate.domain.model.BrokerHolding;
import com.botstate.exception.SourceUnavailableException;
import java.util.Map;

/**
 * Read-only view of the broker account used by reconciliation.
 *
 * <p>Implementations return the rows exactly as the broker reports them; validation of
 * codes, quantities and prices happens in the reconciler, which reports bad rows instead
 * of failing the whole run.
 */
public interface BrokerBalanceClient {

    /**
     * Current holdings keyed by instrument code.
     *
     * @throws SourceUnavailableException if the balance cannot be obtained
     */
    Map<String, BrokerHolding> getBalance();
}
