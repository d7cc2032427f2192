package com.propertyBot.ratingsBot.delivery.service;

import com.propertyBot.ratingsBot.config.properties.DeliveryProperties;
import com.propertyBot.ratingsBot.delivery.model.MessageSink;
import com.propertyBot.ratingsBot.delivery.model.TextChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Sends long text as a sequence of channel-sized messages.
 *
 * Chunks are sent in order. A chunk that fails to send is logged and skipped; the
 * remaining chunks are still attempted. There is no retry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChunkedDelivery {

    private final MessageChunker messageChunker;
    private final DeliveryProperties deliveryProperties;

    /**
     * @return number of chunks delivered without error
     */
    public int deliver(String text, MessageSink sink, String correlationId) {
        List<TextChunk> chunks = messageChunker.split(text, deliveryProperties.getMaxMessageLength());
        if (chunks.size() > 1) {
            log.debug("Splitting message - correlationId: {}, length: {}, chunks: {}",
                    correlationId, text.length(), chunks.size());
        }
        int delivered = 0;
        for (TextChunk chunk : chunks) {
            try {
                sink.sendText(chunk.text());
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Failed to deliver chunk {}/{} - correlationId: {}, error: {}",
                        chunk.index() + 1, chunks.size(), correlationId, e.getMessage(), e);
            }
        }
        return delivered;
    }
}
