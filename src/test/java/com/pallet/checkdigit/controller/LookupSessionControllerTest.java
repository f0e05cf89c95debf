package com.pallet.checkdigit.controller;

import com.pallet.checkdigit.repository.StationRepository;
import com.pallet.checkdigit.model.StationRecord;
import io.micronaut.core.type.Argument;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@MicronautTest(transactional = false)
class LookupSessionControllerTest {

    private static final Argument<Map<String, Object>> JSON_MAP = Argument.mapOf(String.class, Object.class);

    @Inject
    @Client("/")
    HttpClient client;

    @Inject
    StationRepository repository;

    @BeforeEach
    void seed() {
        repository.deleteAll();
        repository.upsert(StationRecord.builder()
                .buildingId(3).stationKey("58-15").checkDigit("69").description("").build(), true);
    }

    private String open() {
        HttpResponse<Map<String, Object>> created = client.toBlocking()
                .exchange(HttpRequest.POST("/api/lookup-sessions", ""), JSON_MAP);
        assertEquals(HttpStatus.CREATED, created.getStatus());
        return (String) created.body().get("sessionId");
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> state(Map<String, Object> view) {
        return (Map<String, Object>) view.get("state");
    }

    private Map<String, Object> awaitSettled(String id) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        Map<String, Object> current = state(client.toBlocking()
                .retrieve(HttpRequest.GET("/api/lookup-sessions/" + id), JSON_MAP));
        while ("LOOKING_UP".equals(current.get("phase")) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            current = state(client.toBlocking()
                    .retrieve(HttpRequest.GET("/api/lookup-sessions/" + id), JSON_MAP));
        }
        return current;
    }

    @Test
    void keystrokesResolveToCheckDigit() throws InterruptedException {
        String id = open();

        Map<String, Object> partial = state(client.toBlocking().retrieve(
                HttpRequest.PUT("/api/lookup-sessions/" + id + "/input", Map.of("input", "58-1")), JSON_MAP));
        assertEquals("TYPING", partial.get("phase"));
        assertEquals(3, ((Number) partial.get("buildingId")).intValue());

        client.toBlocking().exchange(
                HttpRequest.PUT("/api/lookup-sessions/" + id + "/input", Map.of("input", "58-15")));
        Map<String, Object> settled = awaitSettled(id);

        assertEquals("FOUND", settled.get("phase"));
        assertEquals("69", settled.get("checkDigit"));
        assertFalse(settled.containsKey("ticket"));
    }

    @Test
    void switchingBuildingLooksUpAgain() throws InterruptedException {
        String id = open();
        client.toBlocking().exchange(
                HttpRequest.PUT("/api/lookup-sessions/" + id + "/input", Map.of("input", "5815")));
        awaitSettled(id);

        client.toBlocking().exchange(
                HttpRequest.PUT("/api/lookup-sessions/" + id + "/building", Map.of("buildingId", 2)));
        Map<String, Object> settled = awaitSettled(id);

        assertEquals(2, ((Number) settled.get("buildingId")).intValue());
        assertEquals("NOT_FOUND", settled.get("phase"));
    }

    @Test
    void unknownBuildingIsRejected() {
        String id = open();

        HttpClientResponseException e = assertThrows(HttpClientResponseException.class,
                () -> client.toBlocking().exchange(
                        HttpRequest.PUT("/api/lookup-sessions/" + id + "/building", Map.of("buildingId", 7))));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
    }

    @Test
    void clearAndClose() {
        String id = open();
        client.toBlocking().exchange(
                HttpRequest.PUT("/api/lookup-sessions/" + id + "/input", Map.of("input", "58-1")));

        Map<String, Object> cleared = state(client.toBlocking()
                .retrieve(HttpRequest.DELETE("/api/lookup-sessions/" + id + "/input"), JSON_MAP));
        assertEquals("IDLE", cleared.get("phase"));

        HttpResponse<?> closed = client.toBlocking().exchange(HttpRequest.DELETE("/api/lookup-sessions/" + id));
        assertEquals(HttpStatus.NO_CONTENT, closed.getStatus());

        HttpClientResponseException e = assertThrows(HttpClientResponseException.class,
                () -> client.toBlocking().retrieve(HttpRequest.GET("/api/lookup-sessions/" + id), JSON_MAP));
        assertEquals(HttpStatus.NOT_FOUND, e.getStatus());
    }
}
