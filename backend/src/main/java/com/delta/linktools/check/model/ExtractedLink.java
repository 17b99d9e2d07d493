package com.delta.linktools.check.model;

public record ExtractedLink(
    String resolvedUrl,
    String normalizedKey,
    String anchorText
) {
}
