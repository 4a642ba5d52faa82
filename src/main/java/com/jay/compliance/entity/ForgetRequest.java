package com.jay.compliance.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A data-subject removal request. Only the keyed hash of the company identifier
 * is stored; the raw identifier never reaches the database.
 */
@Entity
@Table(name = "forget_requests")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForgetRequest {

    public enum Status { PENDING, COMPLETED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String subjectHash;     // HMAC-SHA256 hex

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Status status;

    private Instant requestedAt;
    private Instant completedAt;
}
