package com.backend.artscan.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ArtworkSource} using its lowercase wire value.
 */
@Converter(autoApply = true)
public class ArtworkSourceConverter implements AttributeConverter<ArtworkSource, String> {

    @Override
    public String convertToDatabaseColumn(ArtworkSource source) {
        return source == null ? null : source.getValue();
    }

    @Override
    public ArtworkSource convertToEntityAttribute(String value) {
        return value == null ? null : ArtworkSource.fromValue(value);
    }
}
