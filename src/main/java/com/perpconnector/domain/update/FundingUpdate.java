package com.perpconnector.domain.update;

import com.perpconnector.domain.enums.UpdateSource;
import com.perpconnector.domain.model.FundingPayment;

/** Latest funding settlement for one pair; may be the "no payment" sentinel. */
public record FundingUpdate(FundingPayment payment, UpdateSource source) implements CanonicalUpdate {}
