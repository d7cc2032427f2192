package com.propertyBot.ratingsBot.datasource.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyBot.ratingsBot.config.properties.DataSourceProperties;
import com.propertyBot.ratingsBot.datasource.model.FetchFailure;
import com.propertyBot.ratingsBot.datasource.model.FetchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class PropertyApiClientTest {

    private static final String BASE_URL = "http://api.test/properties";
    private static final String COMPLAINTS_URL = "http://api.test/complaints";

    private MockRestServiceServer server;
    private DataSourceProperties properties;
    private PropertyApiClient client;

    @BeforeEach
    void setUp() {
        properties = new DataSourceProperties();
        properties.setBaseUrl(BASE_URL);
        properties.setComplaintsUrl(COMPLAINTS_URL);

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new PropertyApiClient(builder.build(), new ObjectMapper(), properties);
    }

    @Nested
    class ListFetch {

        @Test
        void shouldReadBareArray() {
            // Given
            server.expect(requestTo(BASE_URL))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("[{\"id\":1,\"name\":\"Loft\"},{\"id\":2}]", MediaType.APPLICATION_JSON));

            // When
            FetchResult<List<Map<String, Object>>> result = client.fetchRecords(BASE_URL);

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.value()).hasSize(2);
            assertThat(result.value().get(0)).containsEntry("name", "Loft");
            server.verify();
        }

        @Test
        void shouldUnwrapDataEnvelope() {
            server.expect(requestTo(BASE_URL))
                    .andRespond(withSuccess("{\"data\":[{\"id\":\"a\"}],\"page\":1}", MediaType.APPLICATION_JSON));

            FetchResult<List<Map<String, Object>>> result = client.fetchRecords(BASE_URL);

            assertThat(result.value()).containsExactly(Map.of("id", "a"));
        }

        @Test
        void shouldSkipNonObjectElements() {
            server.expect(requestTo(BASE_URL))
                    .andRespond(withSuccess("[{\"id\":1}, 42, \"text\", null]", MediaType.APPLICATION_JSON));

            assertThat(client.fetchRecords(BASE_URL).value()).containsExactly(Map.of("id", 1));
        }

        @Test
        void shouldClassifyServerErrorWithoutThrowing() {
            server.expect(requestTo(BASE_URL)).andRespond(withServerError());

            FetchResult<List<Map<String, Object>>> result = client.fetchRecords(BASE_URL);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.failure()).isEqualTo(FetchFailure.HTTP_STATUS);
            assertThat(result.value()).isNull();
        }

        @Test
        void shouldClassifyUnexpectedShape() {
            server.expect(requestTo(BASE_URL))
                    .andRespond(withSuccess("{\"items\":[]}", MediaType.APPLICATION_JSON));

            assertThat(client.fetchRecords(BASE_URL).failure()).isEqualTo(FetchFailure.UNEXPECTED_SHAPE);
        }

        @Test
        void shouldClassifyInvalidJson() {
            server.expect(requestTo(BASE_URL))
                    .andRespond(withSuccess("<html>oops</html>", MediaType.TEXT_HTML));

            assertThat(client.fetchRecords(BASE_URL).failure()).isEqualTo(FetchFailure.PARSE);
        }

        @Test
        void shouldClassifyTransportError() {
            server.expect(requestTo(BASE_URL)).andRespond(request -> {
                throw new IOException("Connection refused");
            });

            assertThat(client.fetchRecords(BASE_URL).failure()).isEqualTo(FetchFailure.TRANSPORT);
        }

        @Test
        void shouldSendConfiguredAuthHeader() {
            properties.setApiKey("secret");
            server.expect(requestTo(BASE_URL))
                    .andExpect(header("Authorization", "Bearer secret"))
                    .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

            assertThat(client.fetchRecords(BASE_URL).value()).isEmpty();
            server.verify();
        }
    }

    @Nested
    class FetchById {

        @Test
        void shouldReturnDirectRecord() {
            server.expect(requestTo(BASE_URL + "/7"))
                    .andRespond(withSuccess("{\"id\":7,\"name\":\"Cabin\"}", MediaType.APPLICATION_JSON));

            FetchResult<Map<String, Object>> result = client.fetchRecordById(BASE_URL, "7");

            assertThat(result.value()).containsEntry("name", "Cabin");
            server.verify();
        }

        @Test
        void shouldScanListWhenDirectLookupMisses() {
            // Given
            server.expect(requestTo(BASE_URL + "/2")).andRespond(withStatus(HttpStatus.NOT_FOUND));
            server.expect(requestTo(BASE_URL))
                    .andRespond(withSuccess("{\"data\":[{\"id\":1},{\"id\":2,\"name\":\"Barn\"}]}", MediaType.APPLICATION_JSON));

            // When
            FetchResult<Map<String, Object>> result = client.fetchRecordById(BASE_URL, "2");

            // Then
            assertThat(result.value()).containsEntry("name", "Barn");
            server.verify();
        }

        @Test
        void shouldScanListWhenDirectBodyIsNotAnObject() {
            server.expect(requestTo(BASE_URL + "/2"))
                    .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));
            server.expect(requestTo(BASE_URL))
                    .andRespond(withSuccess("[{\"id\":\"2\"}]", MediaType.APPLICATION_JSON));

            assertThat(client.fetchRecordById(BASE_URL, "2").isSuccess()).isTrue();
        }

        @Test
        void shouldReportNotFoundWhenNoRecordMatches() {
            server.expect(requestTo(BASE_URL + "/99")).andRespond(withStatus(HttpStatus.NOT_FOUND));
            server.expect(requestTo(BASE_URL))
                    .andRespond(withSuccess("[{\"id\":1}]", MediaType.APPLICATION_JSON));

            assertThat(client.fetchRecordById(BASE_URL, "99").failure()).isEqualTo(FetchFailure.NOT_FOUND);
        }

        @Test
        void shouldTreatEmptyObjectAsNotFound() {
            server.expect(requestTo(BASE_URL + "/5"))
                    .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

            assertThat(client.fetchRecordById(BASE_URL, "5").failure()).isEqualTo(FetchFailure.NOT_FOUND);
            server.verify();
        }

        @Test
        void shouldHandleTrailingSlashInBaseUrl() {
            server.expect(requestTo(BASE_URL + "/3"))
                    .andRespond(withSuccess("{\"id\":3}", MediaType.APPLICATION_JSON));

            assertThat(client.fetchRecordById(BASE_URL + "/", "3").isSuccess()).isTrue();
        }
    }

    @Nested
    class Complaints {

        @Test
        void shouldFilterByPropertyId() {
            server.expect(requestTo(COMPLAINTS_URL + "?property_id=4"))
                    .andRespond(withSuccess("[{\"id\":1,\"title\":\"Leak\"}]", MediaType.APPLICATION_JSON));

            FetchResult<List<Map<String, Object>>> result = client.fetchComplaints(COMPLAINTS_URL, "4");

            assertThat(result.value()).extracting(complaint -> complaint.get("title")).containsExactly("Leak");
            server.verify();
        }

        @Test
        void shouldReportNotConfiguredWithoutCallingRemote() {
            assertThat(client.fetchComplaints("", "4").failure()).isEqualTo(FetchFailure.NOT_CONFIGURED);
            assertThat(client.fetchComplaints(null, "4").failure()).isEqualTo(FetchFailure.NOT_CONFIGURED);
            server.verify();
        }
    }
}
