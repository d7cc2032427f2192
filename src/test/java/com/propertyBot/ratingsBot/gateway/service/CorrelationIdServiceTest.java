package com.propertyBot.ratingsBot.gateway.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdServiceTest {

    private final CorrelationIdService correlationIdService = new CorrelationIdService();

    @Test
    void shouldReuseSafeInboundId() {
        assertThat(correlationIdService.resolveCorrelationId("req-42.a_b")).isEqualTo("req-42.a_b");
    }

    @Test
    void shouldGenerateIdForMissingOrUnsafeInput() {
        String generated = correlationIdService.resolveCorrelationId(null);

        assertThat(generated).matches("[0-9a-f-]{36}");
        assertThat(correlationIdService.resolveCorrelationId("bad\nvalue")).isNotEqualTo("bad\nvalue");
        assertThat(correlationIdService.resolveCorrelationId("x".repeat(65))).hasSize(36);
    }
}
