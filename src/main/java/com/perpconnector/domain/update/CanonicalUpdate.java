package com.perpconnector.domain.update;

import com.perpconnector.domain.enums.UpdateSource;

/**
 * A normalized, source-agnostic record of one fact change on the exchange.
 *
 * <p>The set of variants is closed: routing in the reconciliation engine dispatches on the
 * concrete type and never on channel strings.
 */
public sealed interface CanonicalUpdate
        permits OrderStatusUpdate, FillUpdate, PositionSnapshot, BalanceSnapshot, FundingUpdate {

    UpdateSource source();
}
