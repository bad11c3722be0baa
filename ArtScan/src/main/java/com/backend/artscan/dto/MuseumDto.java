package com.backend.artscan.dto;

import com.backend.artscan.model.Museum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MuseumDto {
    private Long id;
    private String name;
    private double latitude;
    private double longitude;
    private int geofenceRadiusMeters;

    public static MuseumDto fromModel(Museum museum) {
        return new MuseumDto(museum.getId(), museum.getName(), museum.getLatitude(), museum.getLongitude(),
                museum.getGeofenceRadiusMeters());
    }
}
