package com.propertyBot.ratingsBot.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Service for resolving correlation IDs for request tracking.
 */
@Service
public class CorrelationIdService {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    /**
     * Reuses the caller's correlation ID when it is log-safe, otherwise generates one.
     *
     * @param inbound value of the inbound correlation header, may be null
     * @return correlation ID for this request
     */
    public String resolveCorrelationId(String inbound) {
        if (inbound != null && SAFE_ID.matcher(inbound.trim()).matches()) {
            return inbound.trim();
        }
        return UUID.randomUUID().toString();
    }
}
