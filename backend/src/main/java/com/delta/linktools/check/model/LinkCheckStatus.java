package com.delta.linktools.check.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LinkCheckStatus {
    OK,
    ANCHOR_MISMATCH,
    LINK_NOT_FOUND,
    FETCH_ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
