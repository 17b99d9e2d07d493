package com.delta.linktools.check.model;

import java.util.List;

public record FetchedPage(
    String requestedUrl,
    String finalUrl,
    int statusCode,
    List<ExtractedLink> links
) {
    public FetchedPage {
        links = links == null ? List.of() : List.copyOf(links);
    }
}
