package com.my.todos.domain.service;

import com.my.todos.domain.port.out.ClockPort;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public class MutableClock implements ClockPort {

    private OffsetDateTime current;

    public MutableClock(long epochSeconds) {
        this.current = OffsetDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC);
    }

    public void advanceSeconds(long seconds) {
        current = current.plusSeconds(seconds);
    }

    @Override
    public OffsetDateTime now() {
        return current;
    }
}
