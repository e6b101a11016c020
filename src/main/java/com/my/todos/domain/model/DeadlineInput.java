package com.my.todos.domain.model;

import com.my.todos.domain.exception.DeadlineParseException;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * 왜: 사용자에게는 시(hour) 단위 형식만 노출하고, 내부에서는 UTC 기준 유닉스 초로 일관되게 해석하기 위함.
 */
public record DeadlineInput(String raw) {

    public static final String USER_DATE_TIME_FORMAT = "uuuu-MM-dd HH";

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern(USER_DATE_TIME_FORMAT)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DeadlineInput NONE = new DeadlineInput(null);

    public static DeadlineInput none() {
        return NONE;
    }

    public static DeadlineInput of(String raw) {
        return raw == null ? NONE : new DeadlineInput(raw);
    }

    public boolean isPresent() {
        return raw != null;
    }

    /**
     * 입력이 없으면 빈 값, 있으면 해당 시각의 정각을 유닉스 초로 돌려준다.
     *
     * @throws DeadlineParseException 형식이 맞지 않거나 달력상 존재하지 않는 날짜일 때
     */
    public Optional<Long> resolve() {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            LocalDateTime parsed = LocalDateTime.parse(raw.strip(), FORMATTER);
            return Optional.of(parsed.toEpochSecond(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            throw new DeadlineParseException(raw, USER_DATE_TIME_FORMAT, e);
        }
    }
}
