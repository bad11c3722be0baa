package com.backend.artscan.model;

import lombok.Value;

@Value
public class CatalogOutcome {
    Artwork artwork;
    /** False when a concurrent scan catalogued the same subject first. */
    boolean created;
}
