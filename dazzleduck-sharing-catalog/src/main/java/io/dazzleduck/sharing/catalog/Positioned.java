package io.dazzleduck.sharing.catalog;

import io.dazzleduck.sharing.common.pagination.PageToken;

/**
 * A listed entity together with the token that resumes the listing right after it.
 */
public record Positioned<T, P extends PageToken>(T item, P position) {
}
