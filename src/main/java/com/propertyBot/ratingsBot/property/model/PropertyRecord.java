package com.propertyBot.ratingsBot.property.model;

import com.propertyBot.ratingsBot.property.util.FieldResolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typed view of one property record as returned by the data source.
 * The underlying map has no fixed schema; every accessor tolerates missing keys.
 */
public final class PropertyRecord {

    public static final String NOT_AVAILABLE = "N/A";

    static final String[] ID_KEYS = {"id"};
    static final String[] NAME_KEYS = {"name"};
    static final String[] AIRBNB_KEYS = {"airbnb_rating", "airbnb"};
    static final String[] BOOKING_KEYS = {"booking_rating", "booking"};
    static final String[] LOCATION_KEYS = {"location", "address"};

    private final Map<String, Object> fields;

    private PropertyRecord(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static PropertyRecord of(Map<String, ?> fields) {
        return new PropertyRecord(fields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public String id() {
        return FieldResolver.resolveText(fields, NOT_AVAILABLE, ID_KEYS);
    }

    public String name(String fallback) {
        return FieldResolver.resolveText(fields, fallback, NAME_KEYS);
    }

    /**
     * Airbnb rating exactly as the source wrote it, or {@code N/A}.
     */
    public String airbnbDisplay() {
        return FieldResolver.resolveText(fields, NOT_AVAILABLE, AIRBNB_KEYS);
    }

    /**
     * Booking rating exactly as the source wrote it, or {@code N/A}.
     */
    public String bookingDisplay() {
        return FieldResolver.resolveText(fields, NOT_AVAILABLE, BOOKING_KEYS);
    }

    public RatingPair ratings() {
        return new RatingPair(
                FieldResolver.resolveNumber(fields, AIRBNB_KEYS),
                FieldResolver.resolveNumber(fields, BOOKING_KEYS));
    }

    /**
     * Location for listings: {@code location}, then {@code address}, else empty.
     */
    public String locationOrAddress() {
        return FieldResolver.resolveText(fields, "", LOCATION_KEYS);
    }

    /**
     * The {@code location} field alone; the detailed view does not fall back to {@code address}.
     */
    public Optional<String> location() {
        return optionalField("location");
    }

    public Optional<String> url() {
        return optionalField("url");
    }

    private Optional<String> optionalField(String key) {
        if (!fields.containsKey(key)) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(fields.get(key)));
    }

    @Override
    public String toString() {
        return "PropertyRecord" + fields;
    }
}
