package com.practice.todoapi.todo.domain.model;

/**
 * Paging and filtering for todo listings. Missing or out-of-range values are clamped
 * rather than rejected.
 */
public record ListQuery(Integer limit, Integer offset, Boolean completed) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    public static ListQuery all() {
        return new ListQuery(null, null, null);
    }

    public int limitOrDefault() {
        int lim = limit == null ? DEFAULT_LIMIT : limit;
        return Math.max(1, Math.min(MAX_LIMIT, lim));
    }

    public int offsetOrDefault() {
        return offset == null ? 0 : Math.max(0, offset);
    }
}
