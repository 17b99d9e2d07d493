package com.delta.linktools.check.model;

public record DomainCheckSubmitResponse(boolean accepted, int domainCount, int targetCount) {
}
