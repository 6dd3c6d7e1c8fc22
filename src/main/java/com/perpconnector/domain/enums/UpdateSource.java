package com.perpconnector.domain.enums;

/** Channel a raw exchange payload arrived on. */
public enum UpdateSource {
    STREAM,
    POLL
}
