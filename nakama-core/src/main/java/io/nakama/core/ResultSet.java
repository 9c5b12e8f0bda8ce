package io.nakama.core;

import java.util.List;

/**
 * A page of results.
 *
 * @param results the items of this page
 * @param cursor cursor to fetch the next page, or {@code null} if there is none
 */
public record ResultSet<T>(List<T> results, String cursor) {
    public ResultSet {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
