package com.ai.echomi.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@AllArgsConstructor
public class Route {

    private final List<String> steps;

    private final double distanceKm;

    private final int etaMinutes;
}
