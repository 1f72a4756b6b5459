package com.fitcoach.backend.resolution.model;

import java.util.List;

public record CurrentSupplementsView(
        String programId,
        String planId,
        EffectiveValue<List<SupplementItem>> supplements
) {}
