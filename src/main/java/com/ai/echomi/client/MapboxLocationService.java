package com.ai.echomi.client;

import com.ai.echomi.dto.LocationMatch;
import com.ai.echomi.dto.Route;
import com.ai.echomi.utils.GeoDistance;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Mapbox geocoding (biased towards the destination) and driving directions.
 */
public class MapboxLocationService implements LocationService {

    private static final Logger log = LoggerFactory.getLogger(MapboxLocationService.class);

    private static final String GEOCODING_URL = "https://api.mapbox.com/geocoding/v5/mapbox.places/{query}.json";
    private static final String DIRECTIONS_URL = "https://api.mapbox.com/directions/v5/mapbox/driving/{coordinates}";
    private static final int MAX_SPOKEN_STEPS = 3;

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String accessToken;
    private final double destinationLat;
    private final double destinationLng;
    private final double maxDistanceKm;

    public MapboxLocationService(RestTemplate restTemplate, ObjectMapper mapper, String accessToken,
                                 double destinationLat, double destinationLng, double maxDistanceKm) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.accessToken = accessToken;
        this.destinationLat = destinationLat;
        this.destinationLng = destinationLng;
        this.maxDistanceKm = maxDistanceKm;
    }

    @Override
    public List<LocationMatch> geocode(String query) {
        if (StringUtils.isBlank(query)) return List.of();
        if (StringUtils.isBlank(accessToken)) {
            log.error("Mapbox access token is not set");
            return List.of();
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(GEOCODING_URL)
                .queryParam("access_token", accessToken)
                .queryParam("proximity", destinationLng + "," + destinationLat)
                .queryParam("limit", 5)
                .queryParam("types", "place,address,poi")
                .buildAndExpand(query.trim())
                .encode()
                .toUri();
        try {
            JsonNode root = mapper.readTree(restTemplate.getForObject(uri, String.class));
            List<LocationMatch> matches = new ArrayList<>();
            for (JsonNode feature : root.path("features")) {
                double lng = feature.path("center").path(0).asDouble();
                double lat = feature.path("center").path(1).asDouble();
                double distance = GeoDistance.haversineKm(lat, lng, destinationLat, destinationLng);
                if (distance > maxDistanceKm) continue;
                matches.add(LocationMatch.builder()
                        .name(feature.path("text").asText(feature.path("place_name").asText("")))
                        .address(feature.path("place_name").asText(""))
                        .lat(lat)
                        .lng(lng)
                        .distanceKm(GeoDistance.round1(distance))
                        .build());
            }
            matches.sort(Comparator.comparingDouble(LocationMatch::getDistanceKm));
            log.debug("Mapbox geocode '{}' -> {} matches", query, matches.size());
            return matches;
        } catch (Exception ex) {
            log.error("Mapbox geocoding failed for '{}'", query, ex);
            return List.of();
        }
    }

    @Override
    public Optional<Route> directionsToDestination(LocationMatch origin) {
        if (origin == null || StringUtils.isBlank(accessToken)) return Optional.empty();
        String coordinates = origin.getLng() + "," + origin.getLat() + ";" + destinationLng + "," + destinationLat;
        URI uri = UriComponentsBuilder.fromHttpUrl(DIRECTIONS_URL)
                .queryParam("access_token", accessToken)
                .queryParam("steps", true)
                .queryParam("overview", false)
                .buildAndExpand(coordinates)
                .encode()
                .toUri();
        try {
            JsonNode route = mapper.readTree(restTemplate.getForObject(uri, String.class)).path("routes").path(0);
            if (route.isMissingNode()) {
                log.warn("Mapbox returned no route from {}", origin.getName());
                return Optional.empty();
            }
            List<String> steps = new ArrayList<>();
            for (JsonNode step : route.path("legs").path(0).path("steps")) {
                String instruction = step.path("maneuver").path("instruction").asText("");
                if (!instruction.isEmpty()) steps.add(instruction);
                if (steps.size() == MAX_SPOKEN_STEPS) break;
            }
            double distanceKm = GeoDistance.round1(route.path("distance").asDouble() / 1000.0);
            int etaMinutes = (int) Math.max(1, Math.round(route.path("duration").asDouble() / 60.0));
            return Optional.of(new Route(steps, distanceKm, etaMinutes));
        } catch (Exception ex) {
            log.error("Mapbox directions failed from {}", origin.getName(), ex);
            return Optional.empty();
        }
    }
}
