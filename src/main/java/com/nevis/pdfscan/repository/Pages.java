package com.nevis.pdfscan.repository;

import java.util.List;

/**
 * Skip/take pagination over an already ordered list.
 */
final class Pages {

    private Pages() {
    }

    static <T> List<T> slice(List<T> sorted, int limit, int offset) {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }
        if (offset >= sorted.size()) {
            return List.of();
        }
        int end = (int) Math.min((long) offset + limit, sorted.size());
        return List.copyOf(sorted.subList(offset, end));
    }
}
