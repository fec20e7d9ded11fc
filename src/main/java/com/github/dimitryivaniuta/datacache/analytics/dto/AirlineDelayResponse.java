package com.github.dimitryivaniuta.datacache.analytics.dto;

public record AirlineDelayResponse(
        String airline,
        Double averageDepartureDelay
) {}
