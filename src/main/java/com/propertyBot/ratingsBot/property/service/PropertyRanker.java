package com.propertyBot.ratingsBot.property.service;

import com.propertyBot.ratingsBot.property.model.PropertyRecord;
import com.propertyBot.ratingsBot.property.model.RankedEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders properties by composite score, best first.
 *
 * The sort is stable: properties with equal scores keep their order from the data source.
 * Unrated properties score 0.0 and therefore sink to the bottom.
 */
@Service
@RequiredArgsConstructor
public class PropertyRanker {

    private final RatingAggregator ratingAggregator;

    /**
     * Ranks and truncates.
     *
     * @param properties properties in source order
     * @param limit      maximum number of entries; may exceed the input size
     * @return at most {@code limit} entries; callers should use the returned size as the
     *         displayed count
     */
    public List<RankedEntry> rank(List<PropertyRecord> properties, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }

        List<Scored> scored = new ArrayList<>(properties.size());
        for (PropertyRecord property : properties) {
            scored.add(new Scored(property, ratingAggregator.score(property)));
        }
        // List.sort is a stable merge sort
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());

        int count = Math.min(limit, scored.size());
        List<RankedEntry> ranked = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Scored entry = scored.get(i);
            ranked.add(new RankedEntry(i + 1, entry.property(), entry.score()));
        }
        return ranked;
    }

    private record Scored(PropertyRecord property, double score) {
    }
}
