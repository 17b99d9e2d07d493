package com.delta.linktools.check.model;

public record LinkCheckSubmitResponse(boolean accepted, int rowCount, int siteCount) {
}
