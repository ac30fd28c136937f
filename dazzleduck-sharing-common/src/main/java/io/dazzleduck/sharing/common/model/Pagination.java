package io.dazzleduck.sharing.common.model;

/**
 * Listing request parameters. Both fields are optional: a null {@code maxResults} uses the
 * server's default page size and a null {@code pageToken} starts from the beginning.
 */
public record Pagination(Integer maxResults, String pageToken) {

    public static final Pagination FIRST = new Pagination(null, null);

    public static Pagination of(int maxResults) {
        return new Pagination(maxResults, null);
    }

    public Pagination next(String token) {
        return new Pagination(maxResults, token);
    }
}
