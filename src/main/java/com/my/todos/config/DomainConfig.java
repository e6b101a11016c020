package com.my.todos.config;

import com.my.todos.adapter.out.clock.OffsetClockAdapter;
import com.my.todos.domain.port.in.TodoUseCase;
import com.my.todos.domain.port.out.ClockPort;
import com.my.todos.domain.service.TodoStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * 왜: 저장소 인스턴스를 전역 상태 없이 명시적으로 만들어 포트 구현과 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public TodoUseCase todoUseCase(ClockPort clockPort) {
        return new TodoStore(clockPort);
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        try {
            return OffsetClockAdapter.of(ZoneId.of(appConfig.clock().zone()));
        } catch (DateTimeException e) {
            // 비-prod 프로필에서는 ConfigValidator가 경고만 남기므로 UTC로 대체한다.
            return OffsetClockAdapter.system();
        }
    }
}
