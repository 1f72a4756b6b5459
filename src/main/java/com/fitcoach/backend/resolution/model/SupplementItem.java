package com.fitcoach.backend.resolution.model;

public record SupplementItem(
        String name,
        String dosage,
        String timing,
        String link1,
        String link2
) {

    public static SupplementItem named(String name) {
        return new SupplementItem(name, null, null, null, null);
    }
}
