package com.fitcoach.backend.resolution.model;

import java.util.List;

/**
 * lead 頁面的範圍：這個 lead、它的 customer、以及 customer 底下所有 lead。
 */
public record LeadScope(String leadId, String customerId, List<String> customerLeadIds) {

    public LeadScope {
        customerLeadIds = (customerLeadIds == null) ? List.of() : List.copyOf(customerLeadIds);
    }

    public ClientKey clientKey() {
        return new ClientKey(customerId, leadId);
    }
}
