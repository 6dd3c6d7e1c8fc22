package com.perpconnector.event;

import com.perpconnector.domain.model.FundingPayment;
import org.springframework.context.ApplicationEvent;

/** Published once per newly observed (pair, settlement timestamp) funding payment. */
public class FundingPaymentEvent extends ApplicationEvent {

    private final FundingPayment payment;

    public FundingPaymentEvent(Object source, FundingPayment payment) {
        super(source);
        this.payment = payment;
    }

    public FundingPayment getPayment() {
        return payment;
    }
}
