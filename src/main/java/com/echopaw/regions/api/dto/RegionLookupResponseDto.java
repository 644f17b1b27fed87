package com.echopaw.regions.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RegionLookupResponseDto {

    @JsonProperty("key")
    private KeyDto key;

    @JsonProperty("cached")
    private boolean cached;

    @JsonProperty("records")
    private List<LocationRecordResponseDto> records;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class KeyDto {
        @JsonProperty("lat")
        private double lat;

        @JsonProperty("lng")
        private double lng;

        @JsonProperty("radiusMeters")
        private double radiusMeters;
    }
}
