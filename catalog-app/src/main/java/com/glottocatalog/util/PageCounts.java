package com.glottocatalog.util;

/**
 * Numeric facts derived from a page description. Each value is independently optional.
 */
public record PageCounts(Integer start, Integer end, Integer total) {

    public static final PageCounts NONE = new PageCounts(null, null, null);

    public PageCounts withTotal(Integer total) {
        return new PageCounts(start, end, total);
    }
}
