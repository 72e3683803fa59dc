package com.ai.echomi.client;

import com.ai.echomi.dto.LocationMatch;
import com.ai.echomi.dto.Route;
import com.ai.echomi.utils.TextUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed table of Bangalore landmarks for running without a maps provider.
 * Results are deterministic so conversations can be replayed.
 */
public class MockLocationService implements LocationService {

    private static final List<LocationMatch> LANDMARKS = List.of(
            landmark("Pizza Hut - Koramangala", "123 100 Feet Road, Koramangala, Bangalore 560034", 12.9352, 77.6245, 2.5),
            landmark("McDonald's - Brigade Road", "45 Brigade Road, Ashok Nagar, Bangalore 560001", 12.9716, 77.5946, 3.2),
            landmark("KFC - MG Road", "78 MG Road, Bangalore 560001", 12.9758, 77.6063, 3.8),
            landmark("Starbucks Coffee - UB City Mall", "UB City Mall, Vittal Mallya Road, Bangalore 560001", 12.9719, 77.5937, 4.1),
            landmark("Domino's Pizza - Indiranagar", "234 100 Feet Road, Indiranagar, Bangalore 560038", 12.9784, 77.6408, 5.2),
            landmark("Indiranagar Metro Station", "Chinmaya Mission Hospital Road, Indiranagar, Bangalore 560038", 12.9784, 77.6387, 5.0),
            landmark("The Restaurant - HSR Layout", "567 27th Main Road, HSR Layout, Bangalore 560102", 12.9081, 77.6476, 6.8)
    );

    private static final Set<String> IGNORED_WORDS = Set.of(
            "i", "am", "at", "the", "near", "in", "on", "is", "my", "a", "an", "of", "to",
            "and", "im", "i'm", "here", "now", "road", "bangalore", "main"
    );

    private static final Set<String> FOOD_WORDS = Set.of("food", "restaurant", "delivery", "order");

    private final double maxDistanceKm;

    public MockLocationService(double maxDistanceKm) {
        this.maxDistanceKm = maxDistanceKm;
    }

    private static LocationMatch landmark(String name, String address, double lat, double lng, double distanceKm) {
        return LocationMatch.builder().name(name).address(address).lat(lat).lng(lng).distanceKm(distanceKm).build();
    }

    @Override
    public List<LocationMatch> geocode(String query) {
        String clean = TextUtils.clean(query).toLowerCase().replaceAll("[.,!?]", "");
        if (StringUtils.isBlank(clean)) return List.of();

        List<LocationMatch> matches = new ArrayList<>();
        for (LocationMatch landmark : LANDMARKS) {
            String haystack = (landmark.getName() + " " + landmark.getAddress()).toLowerCase();
            if (mentionsAny(clean, haystack) && landmark.getDistanceKm() <= maxDistanceKm) {
                matches.add(landmark);
            }
        }
        if (matches.isEmpty() && FOOD_WORDS.stream().anyMatch(clean::contains)) {
            matches.add(LANDMARKS.get(0));
            matches.add(LANDMARKS.get(1));
        }
        matches.sort(Comparator.comparingDouble(LocationMatch::getDistanceKm));
        return matches;
    }

    private static boolean mentionsAny(String query, String haystack) {
        for (String word : query.split("\\s+")) {
            if (word.length() >= 3 && !IGNORED_WORDS.contains(word) && haystack.contains(word)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Optional<Route> directionsToDestination(LocationMatch origin) {
        if (origin == null) return Optional.empty();
        List<String> steps = List.of(
                "Head out from " + origin.getName(),
                "Continue straight for about " + origin.getDistanceKm() + " kilometres",
                "Turn left at the second signal and the building is on your right"
        );
        int eta = (int) Math.max(5, Math.round(origin.getDistanceKm() * 3));
        return Optional.of(new Route(steps, origin.getDistanceKm(), eta));
    }
}
