package com.my.todos.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * 왜: 저장소가 소유하는 할 일 레코드를 불변으로 두어 반환값이 곧 복사본이 되도록 하기 위함.
 * 시각 값은 모두 유닉스 초 단위이며 deadline은 없을 수 있다.
 */
public record Todo(
        UUID id,
        String title,
        Priority priority,
        Status status,
        long createdTimestamp,
        long updatedTimestamp,
        Long deadline
) {
    public Todo {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(status, "status");
        if (updatedTimestamp < createdTimestamp) {
            throw new IllegalArgumentException("updatedTimestamp는 createdTimestamp보다 이를 수 없습니다.");
        }
    }

    boolean hasDeadline() {
        return deadline != null;
    }
}
