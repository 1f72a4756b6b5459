package com.fitcoach.backend.resolution.model;

import java.util.List;

public record SupplementPayload(String description, List<SupplementItem> supplements) {

    public SupplementPayload {
        supplements = (supplements == null) ? List.of() : List.copyOf(supplements);
    }
}
