package com.propertyBot.ratingsBot.delivery.model;

/**
 * One slice of a longer message, in delivery order.
 *
 * @param index zero-based position of the chunk
 * @param text  chunk content
 */
public record TextChunk(int index, String text) {

    /**
     * Length in code points.
     */
    public int length() {
        return text.codePointCount(0, text.length());
    }
}
