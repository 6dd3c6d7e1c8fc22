package com.perpconnector.domain.enums;

/**
 * Result of applying one canonical update through the reconciliation engine.
 */
public enum ApplyOutcome {

    /** The update changed local state. */
    APPLIED,

    /** Same trade id already recorded for the order. */
    DUPLICATE,

    /** Older than the order's last update; a fresher observation already won. */
    STALE,

    /** No tracked order owns this update. Logged and dropped. */
    UNATTRIBUTED,

    /** Well-formed but carries nothing new (e.g. funding sentinel, terminal order). */
    IGNORED,

    /** Applying the update threw; the rest of the batch still runs. */
    FAILED
}
