package com.my.todos.domain.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 요청된 정렬 기준마다 레코드 비교 규칙을 한 곳에서 파생시켜, 상위 N 선택과 최종 정렬이 같은 순서를 쓰게 하기 위함.
 * 동순위는 id로 갈라 결과 순서를 결정적으로 만든다.
 */
public final class SortKey {

    /** 상태 정렬 순서: 진행 중, 백로그, 완료. */
    public static final List<Status> STATUS_ORDER = List.of(Status.IN_PROGRESS, Status.BACKLOG, Status.DONE);

    private static final Comparator<Todo> BY_ID = Comparator.comparing(Todo::id);

    private static final Comparator<Todo> BY_PRIORITY =
            Comparator.comparing(Todo::priority, Comparator.reverseOrder());

    private static final Comparator<Todo> BY_STATUS =
            Comparator.comparingInt(todo -> STATUS_ORDER.indexOf(todo.status()));

    private static final Comparator<Todo> BY_DEADLINE =
            Comparator.comparing(Todo::deadline, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<Todo> BY_TITLE = Comparator.comparing(Todo::title);

    private SortKey() {
    }

    public static Comparator<Todo> comparator(Optional<QuerySort> sort) {
        Comparator<Todo> primary = sort.map(SortKey::forDimension).orElse(BY_TITLE);
        return primary.thenComparing(BY_ID);
    }

    private static Comparator<Todo> forDimension(QuerySort sort) {
        return switch (sort) {
            case PRIORITY -> BY_PRIORITY;
            case STATUS -> BY_STATUS;
            case DEADLINE -> BY_DEADLINE;
        };
    }
}
