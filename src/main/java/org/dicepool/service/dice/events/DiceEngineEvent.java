package org.dicepool.service.dice.events;

import org.dicepool.model.dice.RoundEventType;

import java.time.Instant;
import java.util.Map;

/** Événement publié dans le contexte Spring une fois inscrit au journal. */
public record DiceEngineEvent(long eventId, Long roundId, RoundEventType type,
                              Map<String, Object> payload, Instant createdAt) {
}
