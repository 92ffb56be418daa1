package org.dicepool.model.dice;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

// Journal append-only : aucune mise à jour, aucune suppression
@Entity
@Table(name = "dice_round_event", indexes = @Index(columnList = "round_id"))
@Getter
@NoArgsConstructor
public class RoundEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "round_id")
    private Long roundId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private RoundEventType type;

    @Column(name = "payload_json", columnDefinition = "text", nullable = false)
    private String payloadJson;

    @Column(nullable = false)
    private Instant createdAt;

    public RoundEvent(Long roundId, RoundEventType type, String payloadJson, Instant createdAt) {
        this.roundId = roundId;
        this.type = type;
        this.payloadJson = payloadJson;
        this.createdAt = createdAt;
    }
}
