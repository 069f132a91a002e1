package org.handhistory.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Stored outcome of a parsed hand: a few indexed columns plus the whole summary as JSON.
 */
@Entity
@Table(name = "parsed_hand",
        uniqueConstraints = @UniqueConstraint(columnNames = {"room", "ident"}),
        indexes = @Index(name = "ph_parsed_at_idx", columnList = "parsed_at"))
@Data
public class ParsedHand {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 40)
    private String room;

    @Column(nullable = false, length = 40)
    private String ident;

    @Column(name = "played_at")
    private Instant playedAt;

    @Lob
    @Column(name = "summary_json")
    private String summaryJson;

    @Column(name = "parsed_at", nullable = false)
    private Instant parsedAt;

    @PrePersist
    public void prePersist() {
        if (parsedAt == null) parsedAt = Instant.now();
    }
}
