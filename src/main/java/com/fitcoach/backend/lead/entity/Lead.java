package com.fitcoach.backend.lead.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 只映射 resolution 用得到的欄位（lead → customer）。
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "leads")
public class Lead {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "customer_id", length = 36)
    private String customerId;
}
