package com.ai.echomi.client;

import com.ai.echomi.dto.LocationMatch;
import com.ai.echomi.dto.Route;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class MapboxLocationServiceTest {

    private static final double DEST_LAT = 12.9716;
    private static final double DEST_LNG = 77.5946;

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private MapboxLocationService service;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        service = new MapboxLocationService(restTemplate, new ObjectMapper(), "pk.test", DEST_LAT, DEST_LNG, 10);
    }

    @Test
    void shouldDropFeaturesBeyondRange() {
        String body = """
                {"features": [
                  {"text": "Mumbai Central", "place_name": "Mumbai Central, Mumbai", "center": [72.8777, 19.0760]},
                  {"text": "Forum Mall", "place_name": "Forum Mall, Koramangala, Bangalore", "center": [77.6113, 12.9345]}
                ]}
                """;
        server.expect(requestTo(startsWith("https://api.mapbox.com/geocoding/v5/mapbox.places/")))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        List<LocationMatch> matches = service.geocode("Forum Mall");

        assertEquals(1, matches.size());
        assertEquals("Forum Mall", matches.get(0).getName());
        assertTrue(matches.get(0).getDistanceKm() < 10);
    }

    @Test
    void shouldDegradeToNoMatchesOnProviderError() {
        server.expect(requestTo(startsWith("https://api.mapbox.com/geocoding/"))).andRespond(withServerError());

        assertTrue(service.geocode("Forum Mall").isEmpty());
    }

    @Test
    void shouldKeepFirstThreeSpokenSteps() {
        String body = """
                {"routes": [{"distance": 4630, "duration": 900, "legs": [{"steps": [
                  {"maneuver": {"instruction": "Head north"}},
                  {"maneuver": {"instruction": "Turn right onto Hosur Road"}},
                  {"maneuver": {"instruction": "Turn left onto MG Road"}},
                  {"maneuver": {"instruction": "You have arrived"}}
                ]}]}]}
                """;
        server.expect(requestTo(startsWith("https://api.mapbox.com/directions/v5/mapbox/driving/")))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
        LocationMatch origin = LocationMatch.builder().name("Forum Mall").lat(12.9345).lng(77.6113).build();

        Route route = service.directionsToDestination(origin).orElseThrow();

        assertEquals(List.of("Head north", "Turn right onto Hosur Road", "Turn left onto MG Road"), route.getSteps());
        assertEquals(4.6, route.getDistanceKm(), 1e-9);
        assertEquals(15, route.getEtaMinutes());
    }
}
