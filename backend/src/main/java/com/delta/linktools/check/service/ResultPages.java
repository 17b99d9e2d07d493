package com.delta.linktools.check.service;

import com.delta.linktools.check.model.ResultPage;

import java.util.List;
import java.util.function.Predicate;

final class ResultPages {
    private ResultPages() {
    }

    /**
     * Pages over {@code results} after filtering. A page size of zero returns the whole filtered set.
     */
    static <T> ResultPage<T> page(List<T> results, String status, Predicate<T> filter, int page, int pageSize) {
        List<T> filtered = results.stream().filter(filter).toList();
        int safePage = Math.max(1, page);
        if (pageSize <= 0) {
            return new ResultPage<>(status, 1, 0, filtered.size(), filtered.isEmpty() ? 0 : 1, filtered);
        }
        int totalPages = (filtered.size() + pageSize - 1) / pageSize;
        long offset = (long) (safePage - 1) * pageSize;
        int from = (int) Math.min(filtered.size(), offset);
        int to = (int) Math.min(filtered.size(), (long) from + pageSize);
        return new ResultPage<>(status, safePage, pageSize, filtered.size(), totalPages, filtered.subList(from, to));
    }
}
