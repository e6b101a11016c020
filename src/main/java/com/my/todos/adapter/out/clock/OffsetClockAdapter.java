package com.my.todos.adapter.out.clock;

import com.my.todos.domain.port.out.ClockPort;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 왜: 시스템 시간을 주입형으로 제공해 저장소의 생성/수정 시각을 테스트와 분리하기 위함.
 */
public class OffsetClockAdapter implements ClockPort {

    private final ZoneId zoneId;

    private OffsetClockAdapter(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public static OffsetClockAdapter system() {
        return new OffsetClockAdapter(ZoneOffset.UTC);
    }

    public static OffsetClockAdapter of(ZoneId zoneId) {
        return new OffsetClockAdapter(zoneId);
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(zoneId);
    }
}
