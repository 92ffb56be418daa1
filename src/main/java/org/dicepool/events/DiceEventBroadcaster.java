package org.dicepool.events;

import lombok.RequiredArgsConstructor;
import org.dicepool.dto.dice.DiceEventMessage;
import org.dicepool.service.dice.events.DiceEngineEvent;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

// Diffusion STOMP des événements du moteur, seulement après commit
@Component
@RequiredArgsConstructor
public class DiceEventBroadcaster {

    public static final String TOPIC = "/topic/dice/events";

    private final SimpMessagingTemplate broker;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onEngineEvent(DiceEngineEvent e) {
        broker.convertAndSend(TOPIC, toMessage(e));
        if (e.roundId() != null) {
            broker.convertAndSend("/topic/dice/round/" + e.roundId(), toMessage(e));
        }
    }

    public static DiceEventMessage toMessage(DiceEngineEvent e) {
        return DiceEventMessage.builder()
                .eventId(e.eventId())
                .roundId(e.roundId())
                .type(e.type().name())
                .payload(e.payload())
                .createdAt(e.createdAt().toString())
                .build();
    }
}
