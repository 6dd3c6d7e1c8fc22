package com.perpconnector.domain.enums;

/** Direction of a perpetual position, derived from the sign of its amount. */
public enum PositionSide {
    LONG,
    SHORT
}
