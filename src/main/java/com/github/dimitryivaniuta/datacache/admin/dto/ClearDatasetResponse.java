package com.github.dimitryivaniuta.datacache.admin.dto;

public record ClearDatasetResponse(
        String name,
        long deleted
) {}
