package com.ai.echomi.client;

import com.ai.echomi.dto.LocationMatch;
import com.ai.echomi.dto.Route;

import java.util.List;
import java.util.Optional;

/**
 * Geocoding and routing towards the configured delivery destination.
 */
public interface LocationService {

    /**
     * Places matching a free-form description, nearest first. Empty when nothing
     * within range matched or the provider failed.
     */
    List<LocationMatch> geocode(String query);

    Optional<Route> directionsToDestination(LocationMatch origin);
}
