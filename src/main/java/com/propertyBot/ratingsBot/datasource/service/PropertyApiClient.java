package com.propertyBot.ratingsBot.datasource.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyBot.ratingsBot.config.properties.DataSourceProperties;
import com.propertyBot.ratingsBot.datasource.model.FetchFailure;
import com.propertyBot.ratingsBot.datasource.model.FetchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Client for the remote property/complaint JSON data source.
 *
 * Accepts two list shapes from the remote side:
 * - a bare JSON array of records
 * - an object wrapping the array under {@code "data"}
 *
 * No method throws for transport, status or payload problems; each returns a
 * {@link FetchResult} carrying the classified failure instead.
 */
@Slf4j
@Service
public class PropertyApiClient {

    private static final String DATA_ENVELOPE_KEY = "data";
    private static final String ID_KEY = "id";
    private static final String PROPERTY_ID_PARAM = "property_id";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final DataSourceProperties properties;

    public PropertyApiClient(RestClient propertyApiRestClient, ObjectMapper objectMapper,
                             DataSourceProperties properties) {
        this.restClient = propertyApiRestClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Fetches a list of records using the configured headers.
     */
    public FetchResult<List<Map<String, Object>>> fetchRecords(String url) {
        return fetchRecords(url, properties.buildHeaders());
    }

    /**
     * Fetches a list of records.
     *
     * @param url     list endpoint
     * @param headers request headers (auth, accept)
     * @return the records, or a classified failure
     */
    public FetchResult<List<Map<String, Object>>> fetchRecords(String url, HttpHeaders headers) {
        return fetchRecords(URI.create(url), headers);
    }

    /**
     * Fetches a single record, first via {@code baseUrl/id}, then by scanning the full list.
     *
     * @param baseUrl property endpoint
     * @param id      record identifier, compared as a string during the list scan
     * @return the record, {@link FetchFailure#NOT_FOUND} when no record matches
     */
    public FetchResult<Map<String, Object>> fetchRecordById(String baseUrl, String id) {
        URI singleUri = UriComponentsBuilder.fromHttpUrl(stripTrailingSlash(baseUrl))
                .pathSegment(id)
                .build()
                .encode()
                .toUri();

        FetchResult<ResponseEntity<String>> direct = get(singleUri, properties.buildHeaders());
        if (!direct.isSuccess()) {
            // Transport failure on the direct lookup ends the lookup
            log.warn("Direct record lookup failed - url: {}, failure: {}, detail: {}",
                    singleUri, direct.failure(), direct.detail());
            return FetchResult.failure(direct.failure(), direct.detail());
        }

        ResponseEntity<String> response = direct.value();
        if (response.getStatusCode().value() == 200) {
            FetchResult<Object> parsed = parse(response.getBody());
            if (parsed.isSuccess() && parsed.value() instanceof Map<?, ?> map) {
                if (map.isEmpty()) {
                    return FetchResult.failure(FetchFailure.NOT_FOUND, "Empty record for id " + id);
                }
                log.debug("Record {} resolved via direct lookup", id);
                return FetchResult.success(toRecord(map));
            }
            log.debug("Direct lookup for {} returned a non-object body, scanning list", id);
        } else {
            log.debug("Direct lookup for {} returned status {}, scanning list", id, response.getStatusCode());
        }

        FetchResult<List<Map<String, Object>>> all = fetchRecords(baseUrl);
        if (!all.isSuccess()) {
            return FetchResult.failure(all.failure(), all.detail());
        }
        for (Map<String, Object> record : all.value()) {
            if (Objects.equals(String.valueOf(record.get(ID_KEY)), id)) {
                return FetchResult.success(record);
            }
        }
        return FetchResult.failure(FetchFailure.NOT_FOUND, "No record with id " + id);
    }

    /**
     * Fetches complaints filed against one property via {@code ?property_id=}.
     */
    public FetchResult<List<Map<String, Object>>> fetchComplaints(String complaintsUrl, String propertyId) {
        if (complaintsUrl == null || complaintsUrl.isBlank()) {
            return FetchResult.failure(FetchFailure.NOT_CONFIGURED, "Complaints endpoint is not configured");
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(stripTrailingSlash(complaintsUrl))
                .queryParam(PROPERTY_ID_PARAM, propertyId)
                .build()
                .encode()
                .toUri();
        return fetchRecords(uri, properties.buildHeaders());
    }

    private FetchResult<List<Map<String, Object>>> fetchRecords(URI uri, HttpHeaders headers) {
        FetchResult<ResponseEntity<String>> response = get(uri, headers);
        if (!response.isSuccess()) {
            log.warn("Failed to fetch records - url: {}, failure: {}, detail: {}",
                    uri, response.failure(), response.detail());
            return FetchResult.failure(response.failure(), response.detail());
        }

        HttpStatusCode status = response.value().getStatusCode();
        if (!status.is2xxSuccessful()) {
            log.warn("Failed to fetch records - url: {}, status: {}", uri, status);
            return FetchResult.failure(FetchFailure.HTTP_STATUS, "Status " + status.value());
        }

        FetchResult<Object> parsed = parse(response.value().getBody());
        if (!parsed.isSuccess()) {
            log.warn("Failed to parse records - url: {}, detail: {}", uri, parsed.detail());
            return FetchResult.failure(parsed.failure(), parsed.detail());
        }

        FetchResult<List<Map<String, Object>>> records = unwrap(parsed.value());
        if (!records.isSuccess()) {
            log.warn("Unexpected payload format - url: {}, returning empty list", uri);
            return records;
        }
        log.debug("Fetched {} records from {}", records.value().size(), uri);
        return records;
    }

    private FetchResult<ResponseEntity<String>> get(URI uri, HttpHeaders headers) {
        try {
            ResponseEntity<String> response = restClient.get()
                    .uri(uri)
                    .headers(h -> h.putAll(headers))
                    .retrieve()
                    // Status is inspected by the caller
                    .onStatus(HttpStatusCode::isError, (request, res) -> { })
                    .toEntity(String.class);
            return FetchResult.success(response);
        } catch (RestClientException e) {
            return FetchResult.failure(FetchFailure.TRANSPORT, e.getMessage());
        }
    }

    private FetchResult<Object> parse(String body) {
        if (body == null || body.isBlank()) {
            return FetchResult.failure(FetchFailure.PARSE, "Empty body");
        }
        try {
            Object value = objectMapper.readValue(body, Object.class);
            if (value == null) {
                return FetchResult.failure(FetchFailure.UNEXPECTED_SHAPE, "JSON null body");
            }
            return FetchResult.success(value);
        } catch (JsonProcessingException e) {
            return FetchResult.failure(FetchFailure.PARSE, e.getOriginalMessage());
        }
    }

    private FetchResult<List<Map<String, Object>>> unwrap(Object payload) {
        if (payload instanceof List<?> list) {
            return FetchResult.success(toRecords(list));
        }
        if (payload instanceof Map<?, ?> map && map.get(DATA_ENVELOPE_KEY) instanceof List<?> list) {
            return FetchResult.success(toRecords(list));
        }
        return FetchResult.failure(FetchFailure.UNEXPECTED_SHAPE,
                "Expected a list or a {\"data\": [...]} envelope");
    }

    private List<Map<String, Object>> toRecords(List<?> items) {
        List<Map<String, Object>> records = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item instanceof Map<?, ?> map) {
                records.add(toRecord(map));
            } else {
                log.debug("Skipping non-object list element: {}", item);
            }
        }
        return records;
    }

    private Map<String, Object> toRecord(Map<?, ?> map) {
        Map<String, Object> record = new LinkedHashMap<>();
        map.forEach((key, value) -> record.put(String.valueOf(key), value));
        return record;
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
