package com.propertyBot.ratingsBot.property.model;

import com.propertyBot.ratingsBot.property.util.FieldResolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view of one complaint record. Field names vary between data sources, so each
 * accessor walks its alias list.
 */
public final class ComplaintRecord {

    private final Map<String, Object> fields;

    private ComplaintRecord(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static ComplaintRecord of(Map<String, ?> fields) {
        return new ComplaintRecord(fields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public String id() {
        return FieldResolver.resolveText(fields, PropertyRecord.NOT_AVAILABLE, "id");
    }

    public String title() {
        return FieldResolver.resolveText(fields, "No title", "title", "subject");
    }

    public String description() {
        return FieldResolver.resolveText(fields, "No description", "description", "message", "text");
    }

    public String status() {
        return FieldResolver.resolveText(fields, "unknown", "status");
    }

    public String severity() {
        return FieldResolver.resolveText(fields, "", "severity", "priority");
    }

    public String date() {
        return FieldResolver.resolveText(fields, "", "date", "created_at", "createdAt");
    }
}
