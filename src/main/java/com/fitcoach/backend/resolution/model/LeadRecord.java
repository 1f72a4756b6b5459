package com.fitcoach.backend.resolution.model;

public record LeadRecord(String id, String customerId) {}
