package com.perpconnector.domain.model;

import com.perpconnector.domain.enums.PositionSide;

/** Ledger key of a position: one entry per (pair, side). */
public record PositionKey(String tradingPair, PositionSide side) {}
