package com.echopaw.regions.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatsResponseDto {

    @JsonProperty("totalRequests")
    private long totalRequests;

    @JsonProperty("cacheHits")
    private long cacheHits;

    @JsonProperty("cacheMisses")
    private long cacheMisses;

    @JsonProperty("partialHits")
    private long partialHits;

    @JsonProperty("hitRate")
    private double hitRate;

    @JsonProperty("cachedRegions")
    private int cachedRegions;
}
