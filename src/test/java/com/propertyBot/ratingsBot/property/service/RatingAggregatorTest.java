package com.propertyBot.ratingsBot.property.service;

import com.propertyBot.ratingsBot.property.model.PropertyRecord;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RatingAggregatorTest {

    private final RatingAggregator ratingAggregator = new RatingAggregator();

    @Test
    void shouldReturnSentinelWhenNoRatingsPresent() {
        PropertyRecord property = PropertyRecord.of(Map.of("name", "Empty"));

        assertThat(ratingAggregator.score(property)).isEqualTo(0.0);
    }

    @Test
    void shouldAverageBothRatings() {
        PropertyRecord property = PropertyRecord.of(Map.of("airbnb_rating", 4.5, "booking_rating", 5.0));

        assertThat(ratingAggregator.score(property)).isEqualTo(4.75);
    }

    @Test
    void shouldUseSingleAvailableRating() {
        PropertyRecord property = PropertyRecord.of(Map.of("booking_rating", "4.2"));

        assertThat(ratingAggregator.score(property)).isEqualTo(4.2);
    }

    @Test
    void shouldIgnoreNonNumericRating() {
        PropertyRecord property = PropertyRecord.of(Map.of("airbnb_rating", "excellent", "booking_rating", 3));

        assertThat(ratingAggregator.score(property)).isEqualTo(3.0);
    }

    @Test
    void shouldScoreShortAliasLikeLongAlias() {
        PropertyRecord shortAlias = PropertyRecord.of(Map.of("airbnb", 3.8, "booking", 4));
        PropertyRecord longAlias = PropertyRecord.of(Map.of("airbnb_rating", 3.8, "booking_rating", 4));

        assertThat(ratingAggregator.score(shortAlias)).isEqualTo(ratingAggregator.score(longAlias));
    }
}
