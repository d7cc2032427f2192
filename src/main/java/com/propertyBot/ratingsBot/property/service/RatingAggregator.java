package com.propertyBot.ratingsBot.property.service;

import com.propertyBot.ratingsBot.property.model.PropertyRecord;
import com.propertyBot.ratingsBot.property.model.RatingPair;
import org.springframework.stereotype.Service;

/**
 * Computes the composite score of a property: the mean of its available sub-ratings.
 *
 * A property without any usable sub-rating scores {@link #NO_RATING}. That value is a
 * sentinel for "no data" and shares the channel with a genuinely reported score of 0;
 * the two cannot be told apart downstream.
 */
@Service
public class RatingAggregator {

    public static final double NO_RATING = 0.0;

    public double score(PropertyRecord property) {
        return score(property.ratings());
    }

    public double score(RatingPair ratings) {
        double sum = 0.0;
        int count = 0;
        if (ratings.airbnb().isPresent()) {
            sum += ratings.airbnb().getAsDouble();
            count++;
        }
        if (ratings.booking().isPresent()) {
            sum += ratings.booking().getAsDouble();
            count++;
        }
        return count == 0 ? NO_RATING : sum / count;
    }
}
