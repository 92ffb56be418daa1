package org.dicepool.service.dice.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dicepool.model.dice.RoundEvent;
import org.dicepool.model.dice.RoundEventType;
import org.dicepool.repo.RoundEventRepository;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Journal d'audit des manches. L'écriture se fait dans la transaction appelante :
 * une opération annulée n'y laisse aucune trace.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundEventRecorder {
    private final RoundEventRepository repo;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher publisher;

    public DiceEngineEvent record(RoundEventType type, Long roundId, Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>(payload);
        RoundEvent saved = repo.save(new RoundEvent(roundId, type, writePayload(body), Instant.now()));
        DiceEngineEvent evt = new DiceEngineEvent(saved.getId(), roundId, type, body, saved.getCreatedAt());
        publisher.publishEvent(evt);
        log.debug("Événement {} #{} (manche {}) : {}", type, saved.getId(), roundId, body);
        return evt;
    }

    public List<DiceEngineEvent> history(Long roundId) {
        List<RoundEvent> rows = roundId == null
                ? repo.findAllByOrderByIdAsc()
                : repo.findByRoundIdOrderByIdAsc(roundId);
        return rows.stream()
                .map(e -> new DiceEngineEvent(e.getId(), e.getRoundId(), e.getType(), readPayload(e), e.getCreatedAt()))
                .toList();
    }

    private String writePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Payload d'événement non sérialisable", ex);
        }
    }

    private Map<String, Object> readPayload(RoundEvent e) {
        try {
            return objectMapper.readValue(e.getPayloadJson(), new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Payload illisible pour l'événement " + e.getId(), ex);
        }
    }
}
