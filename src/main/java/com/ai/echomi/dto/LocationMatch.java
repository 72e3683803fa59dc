package com.ai.echomi.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class LocationMatch {

    private String name;

    private String address;

    private double lat;

    private double lng;

    private double distanceKm;
}
