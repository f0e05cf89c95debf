package com.pallet.checkdigit.controller;

import com.pallet.checkdigit.repository.StationRepository;
import io.micronaut.core.type.Argument;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@MicronautTest(transactional = false)
class StationControllerTest {

    private static final Argument<Map<String, Object>> JSON_MAP = Argument.mapOf(String.class, Object.class);
    private static final Argument<List<Map<String, Object>>> JSON_LIST = Argument.listOf(JSON_MAP);

    @Inject
    @Client("/")
    HttpClient client;

    @Inject
    StationRepository repository;

    @BeforeEach
    void cleanTable() {
        repository.deleteAll();
    }

    private Map<String, Object> put(int building, String key, String checkDigit, String description) {
        return client.toBlocking().retrieve(
                HttpRequest.PUT("/api/stations/" + building + "/" + key,
                        Map.of("checkDigit", checkDigit, "description", description)),
                JSON_MAP);
    }

    private Map<String, Object> get(String uri) {
        return client.toBlocking().retrieve(HttpRequest.GET(uri), JSON_MAP);
    }

    @Test
    void upsertThenLookupInAnyShorthand() {
        Map<String, Object> stored = put(3, "5815", "69", "Dock A");
        assertEquals("58-15", stored.get("stationKey"));

        Map<String, Object> full = get("/api/stations/3/lookup?input=3-58-15-1");
        assertEquals("FOUND", full.get("status"));
        assertEquals("69", full.get("checkDigit"));
        assertEquals("58-15", full.get("displayForm"));

        Map<String, Object> otherBuilding = get("/api/stations/2/lookup?input=58-15");
        assertEquals("NOT_FOUND", otherBuilding.get("status"));
    }

    @Test
    void lookupWithUsageFeedsQuickAccess() {
        put(3, "58-15", "69", "");
        get("/api/stations/3/lookup?input=5815&recordUsage=true");
        client.toBlocking().exchange(HttpRequest.POST("/api/stations/3/58-15/usage", ""));

        List<Map<String, Object>> mostUsed = client.toBlocking()
                .retrieve(HttpRequest.GET("/api/stations/3/most-used"), JSON_LIST);
        assertEquals(1, mostUsed.size());
        assertEquals(2, ((Number) mostUsed.get(0).get("usageCount")).intValue());

        Map<String, Object> quick = get("/api/stations/3/quick-access");
        assertEquals(1, ((List<?>) quick.get("recent")).size());
        assertTrue(((List<?>) quick.get("frequent")).isEmpty());
    }

    @Test
    void classifyExplainsPartialInput() {
        Map<String, Object> body = get("/api/stations/classify?input=58-1");

        assertEquals("PARTIAL_FORMAT", body.get("classification"));
        assertEquals(false, body.get("resolvable"));
        assertEquals(List.of("58-01", "58-10"), body.get("suggestions"));
    }

    @Test
    void unknownBuildingIsBadRequest() {
        HttpClientResponseException e = assertThrows(HttpClientResponseException.class,
                () -> get("/api/stations/9/lookup?input=58-15"));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
    }

    @Test
    void malformedCheckDigitIsBadRequest() {
        HttpClientResponseException e = assertThrows(HttpClientResponseException.class,
                () -> put(3, "58-15", "6a", ""));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
    }

    @Test
    void searchAisleCountAndExists() {
        put(3, "58-15", "69", "Cold store");
        put(3, "58-16", "90", "");
        put(3, "57-30", "45", "");

        assertEquals(1, client.toBlocking()
                .retrieve(HttpRequest.GET("/api/stations/3/search?q=cold"), JSON_LIST).size());
        assertEquals(2, client.toBlocking()
                .retrieve(HttpRequest.GET("/api/stations/3/aisle/58"), JSON_LIST).size());
        assertEquals(3, client.toBlocking()
                .retrieve(HttpRequest.GET("/api/stations/3"), JSON_LIST).size());
        assertEquals(3, client.toBlocking().retrieve(HttpRequest.GET("/api/stations/3/count"), Integer.class));
        assertEquals(Boolean.TRUE,
                client.toBlocking().retrieve(HttpRequest.GET("/api/stations/3/3-57-30-1/exists"), Boolean.class));
    }

    @Test
    void deleteOneThenBuilding() {
        put(3, "58-15", "69", "");
        put(3, "58-16", "90", "");
        put(2, "40-01", "11", "");

        client.toBlocking().exchange(HttpRequest.DELETE("/api/stations/3/58-15"));
        assertEquals(1, repository.count(3));

        client.toBlocking().exchange(HttpRequest.DELETE("/api/stations/3"));
        assertEquals(0, repository.count(3));
        assertEquals(1, repository.count(2));

        client.toBlocking().exchange(HttpRequest.DELETE("/api/stations"));
        assertEquals(0, repository.countAll());
    }

    @Test
    void importsCsvBody() {
        String csv = """
                station,check_digit,description
                58-15,69,Dock A
                5816,90,
                57-30
                """;

        Map<String, Object> report = client.toBlocking().retrieve(
                HttpRequest.POST("/api/stations/import?buildingId=3", csv).contentType(MediaType.TEXT_PLAIN_TYPE),
                JSON_MAP);

        assertEquals(2, ((Number) report.get("inserted")).intValue());
        assertEquals(1, ((Number) report.get("skipped")).intValue());
        assertEquals(2, repository.count(3));
    }

    @Test
    void emptyImportIsBadRequest() {
        HttpClientResponseException e = assertThrows(HttpClientResponseException.class,
                () -> client.toBlocking().exchange(
                        HttpRequest.POST("/api/stations/import", "station,check_digit\n")
                                .contentType(MediaType.TEXT_PLAIN_TYPE)));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
    }

    @Test
    void backgroundImportCanBePolled() throws InterruptedException {
        HttpResponse<Map<String, Object>> accepted = client.toBlocking().exchange(
                HttpRequest.POST("/api/stations/import/jobs?buildingId=4", "station,check_digit\n40-01,22\n")
                        .contentType(MediaType.TEXT_PLAIN_TYPE),
                JSON_MAP);
        assertEquals(HttpStatus.ACCEPTED, accepted.getStatus());
        String jobId = (String) accepted.body().get("jobId");

        Map<String, Object> status = get("/api/stations/import/jobs/" + jobId);
        long deadline = System.currentTimeMillis() + 5000;
        while ("RUNNING".equals(status.get("state")) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            status = get("/api/stations/import/jobs/" + jobId);
        }

        assertEquals("DONE", status.get("state"));
        assertEquals(1, repository.count(4));
    }

    @Test
    void unknownImportJobIsNotFound() {
        HttpClientResponseException e = assertThrows(HttpClientResponseException.class,
                () -> get("/api/stations/import/jobs/nope"));

        assertEquals(HttpStatus.NOT_FOUND, e.getStatus());
    }

    @Test
    void healthReportsStationCount() {
        put(4, "40-01", "22", "");

        Map<String, Object> health = get("/health");

        assertEquals("UP", health.get("status"));
        assertEquals(1, ((Number) health.get("stations")).intValue());
    }
}
