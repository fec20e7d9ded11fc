package com.github.dimitryivaniuta.datacache.analytics.dto;

public record AirportTrafficResponse(
        String airport,
        long totalFlights
) {}
