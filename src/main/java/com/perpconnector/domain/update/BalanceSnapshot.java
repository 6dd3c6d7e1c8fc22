package com.perpconnector.domain.update;

import com.perpconnector.domain.enums.UpdateSource;
import com.perpconnector.domain.model.Balance;
import java.time.Instant;
import java.util.List;

/** Full set of account balances. Replaces the ledger's balances wholesale. */
public record BalanceSnapshot(List<Balance> balances, Instant timestamp, UpdateSource source)
        implements CanonicalUpdate {

    public BalanceSnapshot {
        balances = List.copyOf(balances);
    }
}
