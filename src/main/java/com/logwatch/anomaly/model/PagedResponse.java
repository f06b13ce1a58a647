package com.logwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

@Schema(description = "One page of results, newest first")
public record PagedResponse<T>(
        List<T> data,
        boolean hasMore,
        @Schema(description = "Pass as 'before' to fetch the next page; null on the last page")
        String nextCursor) {

    /**
     * Cuts an already sorted list down to {@code limit} rows, taking the cursor from the last row kept.
     */
    public static <T> PagedResponse<T> of(List<T> sorted, int limit, Function<T, String> cursorOf) {
        if (sorted.size() <= limit) {
            return new PagedResponse<>(sorted, false, null);
        }
        List<T> page = new ArrayList<>(sorted.subList(0, limit));
        return new PagedResponse<>(page, true, cursorOf.apply(page.get(limit - 1)));
    }
}
