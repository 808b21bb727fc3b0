package com.driftmonitor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "active_baselines")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActiveBaselinePointer {

    @Id
    @Column(name = "model_id", length = 100)
    private String modelId;

    @Column(name = "snapshot_id", nullable = false)
    private UUID snapshotId;

    @Column(name = "activated_at", nullable = false)
    private Instant activatedAt;

    @Version
    private Long revision;
}
