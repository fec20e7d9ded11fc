package com.github.dimitryivaniuta.datacache.admin.dto;

import java.util.List;

public record DatasetSummaryResponse(
        String name,
        int rowCount,
        List<String> columns
) {}
