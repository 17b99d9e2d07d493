package com.delta.linktools.check.model;

import java.util.List;

public record ResultPage<T>(
    String status,
    int page,
    int pageSize,
    int totalItems,
    int totalPages,
    List<T> items
) {
}
