package com.ai.echomi.client;

import com.ai.echomi.dto.LocationMatch;
import com.ai.echomi.dto.Route;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MockLocationServiceTest {

    private final MockLocationService service = new MockLocationService(10);

    @Test
    void shouldRankLandmarksNearestFirst() {
        List<LocationMatch> matches = service.geocode("I am at Koramangala metro station");

        assertEquals("Pizza Hut - Koramangala", matches.get(0).getName());
        assertEquals("Indiranagar Metro Station", matches.get(1).getName());
    }

    @Test
    void shouldRespectMaximumDistance() {
        assertTrue(new MockLocationService(3).geocode("near the HSR Layout").isEmpty());
    }

    @Test
    void shouldSuggestFoodPlacesForGenericFoodMention() {
        List<LocationMatch> matches = service.geocode("food delivery point");

        assertEquals(2, matches.size());
    }

    @Test
    void shouldReturnNothingForUnknownPlace() {
        assertTrue(service.geocode("somewhere unknown xyz").isEmpty());
        assertTrue(service.geocode("  ").isEmpty());
    }

    @Test
    void shouldBuildRouteWithEta() {
        LocationMatch origin = service.geocode("Koramangala").get(0);

        Route route = service.directionsToDestination(origin).orElseThrow();

        assertEquals(3, route.getSteps().size());
        assertEquals(8, route.getEtaMinutes());
    }
}
