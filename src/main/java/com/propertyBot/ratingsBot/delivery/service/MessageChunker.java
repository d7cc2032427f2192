package com.propertyBot.ratingsBot.delivery.service;

import com.propertyBot.ratingsBot.delivery.model.TextChunk;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into contiguous chunks no longer than the channel limit.
 *
 * Lengths are Unicode code points, so a boundary never falls inside a surrogate pair and
 * text of length L at limit N always yields ceil(L/N) chunks.
 */
@Service
public class MessageChunker {

    public List<TextChunk> split(String text, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        List<TextChunk> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }
        int remaining = text.codePointCount(0, text.length());
        int start = 0;
        while (remaining > 0) {
            int take = Math.min(limit, remaining);
            int end = text.offsetByCodePoints(start, take);
            chunks.add(new TextChunk(chunks.size(), text.substring(start, end)));
            start = end;
            remaining -= take;
        }
        return chunks;
    }
}
