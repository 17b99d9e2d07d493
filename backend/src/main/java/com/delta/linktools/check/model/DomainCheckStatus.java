package com.delta.linktools.check.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DomainCheckStatus {
    OK,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
