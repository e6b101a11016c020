package com.my.todos.adapter.in.idempotency;

import com.my.todos.config.AppConfig;
import com.my.todos.domain.port.out.ClockPort;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 재전송된 명령(특히 add)이 같은 할 일을 두 번 만들지 않도록 TTL 동안 처리한 commandId를 기억하기 위함.
 * 저장소와 마찬가지로 재시작 후에는 유지되지 않는다.
 */
@ApplicationScoped
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final Duration ttl;
    private final ClockPort clockPort;
    private final Map<String, Instant> processed = new ConcurrentHashMap<>();

    public InMemoryIdempotencyStore(AppConfig appConfig, ClockPort clockPort) {
        this.ttl = Duration.ofHours(appConfig.idempotency().ttlHours());
        this.clockPort = clockPort;
    }

    @Override
    public boolean isProcessed(String commandId) {
        cleanup();
        return processed.containsKey(commandId);
    }

    @Override
    public void markProcessed(String commandId) {
        cleanup();
        processed.put(commandId, clockPort.now().toInstant());
    }

    private void cleanup() {
        Instant cutoff = clockPort.now().toInstant().minus(ttl);
        processed.entrySet().removeIf(entry -> entry.getValue().isBefore(cutoff));
    }
}
