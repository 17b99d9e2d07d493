package com.delta.linktools.check.model;

public record ExpectedLinkRow(
    int rowNum,
    String site,
    String link,
    String anchor
) {
    public ExpectedLinkRow {
        anchor = anchor == null ? "" : anchor;
    }
}
