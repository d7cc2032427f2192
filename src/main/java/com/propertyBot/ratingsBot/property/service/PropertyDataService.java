package com.propertyBot.ratingsBot.property.service;

import com.propertyBot.ratingsBot.config.properties.DataSourceProperties;
import com.propertyBot.ratingsBot.datasource.model.FetchResult;
import com.propertyBot.ratingsBot.datasource.service.PropertyApiClient;
import com.propertyBot.ratingsBot.property.model.ComplaintRecord;
import com.propertyBot.ratingsBot.property.model.PropertyRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads properties and complaints for one request.
 *
 * Every fetch failure is logged here and degraded to an empty result, which the caller
 * renders as a "no data" or "not found" message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PropertyDataService {

    private final PropertyApiClient propertyApiClient;
    private final DataSourceProperties properties;

    /**
     * All properties from the base endpoint (the ratings source).
     */
    public List<PropertyRecord> fetchAllProperties(String correlationId) {
        return toProperties(propertyApiClient.fetchRecords(properties.getBaseUrl()), "all properties", correlationId);
    }

    /**
     * Properties from the listing endpoint, which may differ from the ratings source.
     */
    public List<PropertyRecord> fetchPropertiesList(String correlationId) {
        return toProperties(propertyApiClient.fetchRecords(properties.resolvePropertiesUrl()),
                "properties list", correlationId);
    }

    public Optional<PropertyRecord> fetchPropertyById(String propertyId, String correlationId) {
        FetchResult<Map<String, Object>> result = propertyApiClient.fetchRecordById(properties.getBaseUrl(), propertyId);
        if (!result.isSuccess()) {
            log.warn("Property lookup degraded to not found - correlationId: {}, propertyId: {}, failure: {}",
                    correlationId, propertyId, result.failure());
            return Optional.empty();
        }
        return Optional.of(PropertyRecord.of(result.value()));
    }

    public boolean isComplaintsConfigured() {
        return properties.isComplaintsConfigured();
    }

    public List<ComplaintRecord> fetchComplaints(String propertyId, String correlationId) {
        FetchResult<List<Map<String, Object>>> result =
                propertyApiClient.fetchComplaints(properties.getComplaintsUrl(), propertyId);
        if (!result.isSuccess()) {
            log.warn("Complaints fetch degraded to empty - correlationId: {}, propertyId: {}, failure: {}, detail: {}",
                    correlationId, propertyId, result.failure(), result.detail());
            return List.of();
        }
        return result.value().stream()
                .map(ComplaintRecord::of)
                .toList();
    }

    private List<PropertyRecord> toProperties(FetchResult<List<Map<String, Object>>> result,
                                              String what, String correlationId) {
        if (!result.isSuccess()) {
            log.warn("Fetch of {} degraded to empty - correlationId: {}, failure: {}, detail: {}",
                    what, correlationId, result.failure(), result.detail());
            return List.of();
        }
        log.debug("Fetched {} - correlationId: {}, count: {}", what, correlationId, result.value().size());
        return result.value().stream()
                .map(PropertyRecord::of)
                .toList();
    }
}
