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
 * A diplomatic press message. Sender and recipient are plain player names;
 * the recipient is {@value #PUBLIC} for messages addressed to everybody.
 */
@Entity
@Table(name = "press_messages")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PressMessage {

    public static final String PUBLIC = "public";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String sender;

    @Column(nullable = false)
    private String recipient;

    @Column(nullable = false, length = 2000)
    private String body;

    @Column(nullable = false)
    private int phaseCount;

    @Column(nullable = false)
    private LocalDateTime sentAt;

    @PrePersist
    public void prePersist() {
        if (sentAt == null) {
            sentAt = LocalDateTime.now();
        }
    }

    public boolean isPublic() {
        return PUBLIC.equals(recipient);
    }

    /**
     * Console rendering: {@code "<from>: <message>"} or {@code "<from>/public: <message>"}.
     */
    public String format() {
        return (isPublic() ? sender + "/" + PUBLIC : sender) + ": " + body;
    }
}
