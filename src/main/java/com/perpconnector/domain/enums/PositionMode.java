package com.perpconnector.domain.enums;

/**
 * Account position mode. Only ONEWAY is supported: at most one open position per pair.
 */
public enum PositionMode {
    ONEWAY
}
