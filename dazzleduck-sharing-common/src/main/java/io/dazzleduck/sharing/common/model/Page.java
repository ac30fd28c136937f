package io.dazzleduck.sharing.common.model;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * One page of a listing. {@code nextPageToken} is null when no further entities exist.
 */
public record Page<T>(List<T> items, String nextPageToken) {

    public Page {
        items = List.copyOf(items);
    }

    public static <T> Page<T> last(List<T> items) {
        return new Page<>(items, null);
    }

    public Optional<String> next() {
        return Optional.ofNullable(nextPageToken);
    }

    public <R> Page<R> map(Function<? super T, ? extends R> mapper) {
        return new Page<>(items.stream().<R>map(mapper).toList(), nextPageToken);
    }
}
