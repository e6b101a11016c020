package com.my.todos.domain.model;

import com.my.todos.domain.exception.DataConversionException;

/**
 * 왜: 검색 결과 상한을 외부 입력과 무관하게 항상 1..MAX 범위로 보정하기 위함.
 * 원본 값은 부호 없는 32비트 범위를 담기 위해 Long으로 받는다.
 */
public record ResultLimit(Long value) {

    public static final int DEFAULT = 10;
    public static final int MAX = 100;

    private static final ResultLimit UNSET = new ResultLimit(null);

    public static ResultLimit unset() {
        return UNSET;
    }

    public static ResultLimit of(Long value) {
        return value == null ? UNSET : new ResultLimit(value);
    }

    public int resolve() {
        long bounded;
        if (value == null || value < 1) {
            bounded = DEFAULT;
        } else if (value > MAX) {
            bounded = MAX;
        } else {
            bounded = value;
        }
        try {
            return Math.toIntExact(bounded);
        } catch (ArithmeticException e) {
            throw DataConversionException.u32ToUsize(bounded, e);
        }
    }
}
