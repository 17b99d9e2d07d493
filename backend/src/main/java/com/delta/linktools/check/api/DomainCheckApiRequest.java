package com.delta.linktools.check.api;

public record DomainCheckApiRequest(
    String domains,
    String targets,
    Integer threads,
    Integer timeout
) {
}
