package com.olend.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the config_change_history table.
 * One row per capability-gated configuration change.
 */
@Entity
@Table(name = "config_change_history")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConfigChangeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "config_type", length = 50, nullable = false)
    private String configType;

    @Column(name = "config_key", length = 100)
    private String configKey;

    @Column(name = "old_value", columnDefinition = "TEXT")
    private String oldValue;

    @Column(name = "new_value", columnDefinition = "TEXT")
    private String newValue;

    /** Capability id that authorised the change. */
    @Column(name = "changed_by", length = 100)
    private String changedBy;

    @Column(name = "logical_timestamp")
    private long logicalTimestamp;

    @Column(name = "recorded_at")
    private LocalDateTime recordedAt;
}
