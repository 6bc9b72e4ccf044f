package com.naag.docsync.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record SearchRequest(
        @NotBlank(message = "query is required")
        String query,
        @NotEmpty(message = "at least one collection is required")
        List<String> collections,
        @Max(value = 50, message = "limit must be at most 50")
        Integer limit,
        Boolean widen
) {
    public int getLimitOrDefault(int defaultLimit) {
        return limit != null && limit > 0 ? limit : defaultLimit;
    }

    public boolean isWiden() {
        return widen == null || widen;
    }
}
