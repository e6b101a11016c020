package com.my.todos.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResultLimitTest {

    @Test
    void unsetFallsBackToDefault() {
        assertThat(ResultLimit.unset().resolve()).isEqualTo(ResultLimit.DEFAULT);
    }

    @Test
    void zeroFallsBackToDefault() {
        assertThat(ResultLimit.of(0L).resolve()).isEqualTo(10);
    }

    @Test
    void clampsToMaximum() {
        assertThat(ResultLimit.of(200L).resolve()).isEqualTo(100);
        assertThat(ResultLimit.of(4_294_967_295L).resolve()).isEqualTo(ResultLimit.MAX);
    }

    @Test
    void keepsValueWithinRange() {
        assertThat(ResultLimit.of(1L).resolve()).isEqualTo(1);
        assertThat(ResultLimit.of(100L).resolve()).isEqualTo(100);
        assertThat(ResultLimit.of(37L).resolve()).isEqualTo(37);
    }
}
