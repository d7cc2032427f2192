package com.propertyBot.ratingsBot.property.model;

/**
 * A property annotated with its composite score and 1-based rank.
 */
public record RankedEntry(int rank, PropertyRecord property, double score) {
}
