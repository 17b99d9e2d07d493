package com.delta.linktools.check.api;

public record LinkCheckApiRequest(
    String csv,
    Integer threads,
    Integer timeout
) {
}
