package com.spotifydump.spotify;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Items of one page plus where to go next.
 *
 * @param items        raw records in server order
 * @param cursor       absolute next-page URL or {@code after} token; {@code null} on the last page
 * @param fetchedSoFar items accumulated including this page
 */
public record PageResult(List<JsonNode> items, String cursor, int fetchedSoFar) {

    public PageResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean hasNext() {
        return cursor != null;
    }
}
