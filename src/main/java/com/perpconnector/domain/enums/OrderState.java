package com.perpconnector.domain.enums;

/**
 * Lifecycle state of a locally tracked order.
 *
 * <p>PENDING_CREATE is our internal pre-acknowledgement state. States only move forward
 * (by {@link #rank()}); FILLED, CANCELED and FAILED are terminal.
 */
public enum OrderState {
    PENDING_CREATE(0),
    OPEN(1),
    PARTIALLY_FILLED(2),
    FILLED(3),
    CANCELED(3),
    FAILED(3);

    private final int rank;

    OrderState(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isTerminal() {
        return this == FILLED || this == CANCELED || this == FAILED;
    }

    /** True if moving from this state to {@code next} does not go backwards. */
    public boolean canAdvanceTo(OrderState next) {
        if (isTerminal()) {
            return false;
        }
        return next.rank >= rank;
    }
}
