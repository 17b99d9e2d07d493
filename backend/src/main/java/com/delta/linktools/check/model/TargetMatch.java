package com.delta.linktools.check.model;

import java.util.List;

public record TargetMatch(boolean found, List<String> anchors) {
    public TargetMatch {
        anchors = anchors == null ? List.of() : List.copyOf(anchors);
    }

    public static TargetMatch notFound() {
        return new TargetMatch(false, List.of());
    }
}
