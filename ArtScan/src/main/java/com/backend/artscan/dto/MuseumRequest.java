package com.backend.artscan.dto;

import com.backend.artscan.model.Museum;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MuseumRequest {
    @NotBlank(message = "Name is required")
    private String name;

    @NotNull(message = "Latitude is required")
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double latitude;

    @NotNull(message = "Longitude is required")
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double longitude;

    @NotNull(message = "Geofence radius is required")
    @Min(value = 0, message = "Geofence radius cannot be negative")
    private Integer geofenceRadiusMeters;

    public Museum toModel() {
        return Museum.builder()
                .name(name)
                .latitude(latitude)
                .longitude(longitude)
                .geofenceRadiusMeters(geofenceRadiusMeters)
                .build();
    }
}
