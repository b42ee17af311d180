package com.diplomacy.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * One resolved order in the phase log, e.g. key "Phase 1 move", player "ENG", order "LON_C M NTH_C".
 */
@Entity
@Table(name = "phase_log")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PhaseLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String phaseKey;

    @Column(nullable = false)
    private String playerName;

    /** Order in log notation; null when the player is listed without orders. */
    @Column
    private String orderText;

    /** Global ordinal, keeps phases and orders in submission order. */
    @Column(nullable = false)
    private long sequence;

    @Column(nullable = false)
    private LocalDateTime recordedAt;

    @PrePersist
    public void prePersist() {
        if (recordedAt == null) {
            recordedAt = LocalDateTime.now();
        }
    }
}
