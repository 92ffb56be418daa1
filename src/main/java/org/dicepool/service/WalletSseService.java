package org.dicepool.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
@Component
public class WalletSseService {
    private final Map<String, List<SseEmitter>> emitters = new ConcurrentHashMap<>();

    public SseEmitter register(String email) {
        SseEmitter emitter = new SseEmitter(6L * 60 * 60 * 1000L);
        emitters.computeIfAbsent(email, k -> new CopyOnWriteArrayList<>()).add(emitter);

        emitter.onCompletion(() -> removeEmitter(email, emitter));
        emitter.onTimeout(() -> removeEmitter(email, emitter));
        emitter.onError((e) -> removeEmitter(email, emitter));

        try {
            emitter.send(SseEmitter.event().name("wallet-ready").data(email));
        } catch (IOException e) {
            log.debug("SSE fermé dès la connexion pour {}", email);
            removeEmitter(email, emitter);
        }

        return emitter;
    }

    private void removeEmitter(String email, SseEmitter emitter) {
        List<SseEmitter> list = emitters.get(email);
        if (list != null) {
            list.remove(emitter);
            if (list.isEmpty()) emitters.remove(email);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBalanceChanged(WalletBalanceChanged e) {
        sendBalanceUpdate(e.email(), e.solde());
    }

    public void sendBalanceUpdate(String email, long solde) {
        List<SseEmitter> list = emitters.get(email);
        if (list == null) return;

        for (SseEmitter emitter : list.toArray(new SseEmitter[0])) {
            try {
                emitter.send(SseEmitter.event()
                        .name("wallet-update")
                        .data(Map.of("solde", solde)));
            } catch (IOException e) {
                removeEmitter(email, emitter);
            }
        }
    }

    @Scheduled(fixedDelay = 15000)
    public void heartbeat() {
        for (var entry : emitters.entrySet()) {
            String email = entry.getKey();
            for (SseEmitter emitter : entry.getValue().toArray(new SseEmitter[0])) {
                try {
                    emitter.send(SseEmitter.event().name("ping").data("keepalive"));
                } catch (IOException e) {
                    removeEmitter(email, emitter);
                }
            }
        }
    }
}
