package com.my.todos.domain.port.out;

import java.time.OffsetDateTime;

/**
 * 왜: 생성/수정 시각을 주입형으로 분리하여 타임스탬프 갱신 규칙을 테스트에서 통제하기 위함.
 */
public interface ClockPort {
    OffsetDateTime now();

    default long nowEpochSeconds() {
        return now().toEpochSecond();
    }
}
