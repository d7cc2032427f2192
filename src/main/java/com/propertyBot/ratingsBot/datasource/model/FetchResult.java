package com.propertyBot.ratingsBot.datasource.model;

import java.util.Objects;

/**
 * Outcome of a data source call: either a value or a classified failure.
 *
 * @param value   the fetched value, null on failure
 * @param failure failure reason, null on success
 * @param detail  human readable failure detail for logs
 */
public record FetchResult<T>(T value, FetchFailure failure, String detail) {

    public static <T> FetchResult<T> success(T value) {
        return new FetchResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> FetchResult<T> failure(FetchFailure failure, String detail) {
        return new FetchResult<>(null, Objects.requireNonNull(failure, "failure"), detail);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
