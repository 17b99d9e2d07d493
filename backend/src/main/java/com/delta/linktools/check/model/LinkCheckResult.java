package com.delta.linktools.check.model;

import java.util.List;

public record LinkCheckResult(
    int rowNum,
    String site,
    String expectedLink,
    String expectedAnchor,
    LinkCheckStatus status,
    List<String> foundAnchors,
    String error
) {
    public LinkCheckResult {
        foundAnchors = foundAnchors == null ? List.of() : List.copyOf(foundAnchors);
    }
}
