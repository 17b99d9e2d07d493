package com.delta.linktools.check.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound-link summary for one referring domain. {@code targets} keeps the order in which target
 * domains were requested.
 */
public record DomainCheckResult(
    String domain,
    DomainCheckStatus status,
    String error,
    int linksCount,
    Map<String, TargetMatch> targets
) {
    public DomainCheckResult {
        targets = targets == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(targets));
    }

    public boolean hasAnyTarget() {
        return targets.values().stream().anyMatch(TargetMatch::found);
    }
}
