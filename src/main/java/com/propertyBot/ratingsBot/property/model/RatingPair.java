package com.propertyBot.ratingsBot.property.model;

import java.util.OptionalDouble;

/**
 * The two guest-review sub-ratings of a property, each independently present or absent.
 *
 * @param airbnb  Airbnb rating
 * @param booking Booking.com rating
 */
public record RatingPair(OptionalDouble airbnb, OptionalDouble booking) {
}
