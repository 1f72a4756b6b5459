package com.fitcoach.backend.resolution.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * client = customer 和/或 lead。兩個都沒有時整個 resolution 回空結果（不是錯誤）。
 */
public record ClientKey(String customerId, String leadId) {

    public ClientKey {
        customerId = blankToNull(customerId);
        leadId = blankToNull(leadId);
    }

    public static ClientKey of(String customerId, String leadId) {
        return new ClientKey(customerId, leadId);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return customerId == null && leadId == null;
    }

    private static String blankToNull(String v) {
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
