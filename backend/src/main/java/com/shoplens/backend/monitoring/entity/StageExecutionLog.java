package com.shoplens.backend.monitoring.entity;

import com.shoplens.backend.model.enums.StageName;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "stage_execution_log", indexes = {
        @Index(name = "idx_stage_log_stage", columnList = "stage"),
        @Index(name = "idx_stage_log_recorded_at", columnList = "recordedAt")
})
public class StageExecutionLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String jobId;

    @Column(length = 4000)
    private String sourceRef;

    @Column(nullable = false, length = 20)
    private String kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private StageName stage;

    @Column(nullable = false)
    private Boolean success;

    private Long durationMs;

    @Column(length = 4000)
    private String errorMessage;

    @Column(nullable = false)
    private LocalDateTime recordedAt;
}
