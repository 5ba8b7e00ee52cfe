package com.example.chat.service.gateway;

import com.example.chat.config.AppProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;

/**
 * Pings every open session on a fixed interval and terminates the ones that stayed silent
 * for more than the allowed number of intervals.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LivenessMonitor {

    private final SessionRegistry sessionRegistry;
    private final ChatGateway chatGateway;
    private final AppProperties appProperties;
    private final Clock clock;

    private Disposable heartbeatSubscription;

    @PostConstruct
    public void init() {
        Duration interval = appProperties.getWebsocket().getPingInterval();
        heartbeatSubscription = Flux.interval(interval, Schedulers.parallel())
                .onBackpressureDrop()
                .publishOn(Schedulers.boundedElastic())
                .doOnNext(this::sweep)
                .subscribe();
    }

    @PreDestroy
    public void cleanup() {
        if (heartbeatSubscription != null && !heartbeatSubscription.isDisposed()) {
            heartbeatSubscription.dispose();
        }
    }

    /**
     * @return number of sessions terminated in this sweep
     */
    int sweep(long tick) {
        AppProperties.WebSocket websocket = appProperties.getWebsocket();
        long silenceLimit = websocket.getPingInterval().toMillis() * websocket.getMissedPingsAllowed();
        long now = clock.millis();
        int terminated = 0;
        for (ChatSession session : sessionRegistry.all()) {
            try {
                long silentFor = now - session.getLastSeen();
                if (silentFor > silenceLimit) {
                    log.info("Session {} timed out (silent for {} ms)", session.getId(), silentFor);
                    chatGateway.terminate(session);
                    terminated++;
                } else {
                    session.requestPing(tick);
                }
            } catch (RuntimeException e) {
                log.error("Error in liveness sweep for session {}: {}", session.getId(), e.getMessage());
            }
        }
        return terminated;
    }
}
