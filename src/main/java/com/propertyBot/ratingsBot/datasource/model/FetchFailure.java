package com.propertyBot.ratingsBot.datasource.model;

/**
 * Classified reasons a data source call produced no usable value.
 */
public enum FetchFailure {
    /** Connection refused, timeout or other I/O error. */
    TRANSPORT,
    /** Non-2xx response status. */
    HTTP_STATUS,
    /** Body is not valid JSON. */
    PARSE,
    /** Valid JSON that is neither a list nor a {@code {"data": [...]}} envelope. */
    UNEXPECTED_SHAPE,
    /** Lookup by id found no matching record. */
    NOT_FOUND,
    /** The endpoint needed for the call is not configured. */
    NOT_CONFIGURED
}
