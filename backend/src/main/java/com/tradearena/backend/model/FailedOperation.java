package com.tradearena.backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Manual-review queue entry: an item the core refused to guess about.
 */
@Entity
@Table(name = "failed_operations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailedOperation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String operationType;

    @Column(nullable = false, length = 500)
    private String details;

    @Column(length = 2000)
    private String errorMessage;

    private boolean resolved;

    private int retryCount;

    @Column(nullable = false)
    private Instant timestamp;
}
