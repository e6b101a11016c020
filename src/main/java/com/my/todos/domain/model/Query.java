package com.my.todos.domain.model;

import java.util.Optional;

/**
 * 왜: 검색/집계 조건을 한 덩어리로 묶고, 각 조건이 비어 있으면 전부 통과하는 필터 규칙을 한 곳에 두기 위함.
 */
public record Query(
        String keyword,
        Priority priority,
        Status status,
        DeadlineInput deadline,
        QuerySort sort,
        ResultLimit limit
) {
    public Query {
        deadline = deadline == null ? DeadlineInput.none() : deadline;
        limit = limit == null ? ResultLimit.unset() : limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Query all() {
        return builder().build();
    }

    public Optional<QuerySort> sortBy() {
        return Optional.ofNullable(sort);
    }

    /**
     * 네 조건을 AND로 결합한다. deadlineBound는 {@link DeadlineInput#resolve()}로 미리 해석한 값이다.
     */
    public boolean matches(Todo todo, Optional<Long> deadlineBound) {
        return matchKeyword(todo)
                && matchPriority(todo)
                && matchStatus(todo)
                && matchDeadline(todo, deadlineBound);
    }

    boolean matchKeyword(Todo todo) {
        return keyword == null || todo.title().contains(keyword);
    }

    boolean matchPriority(Todo todo) {
        return priority == null || priority == todo.priority();
    }

    boolean matchStatus(Todo todo) {
        return status == null || status == todo.status();
    }

    static boolean matchDeadline(Todo todo, Optional<Long> deadlineBound) {
        // 마감 시각이 없는 항목은 상한 조건에서 제외하지 않는다.
        return deadlineBound
                .map(bound -> !todo.hasDeadline() || todo.deadline() <= bound)
                .orElse(true);
    }

    public static final class Builder {
        private String keyword;
        private Priority priority;
        private Status status;
        private DeadlineInput deadline = DeadlineInput.none();
        private QuerySort sort;
        private ResultLimit limit = ResultLimit.unset();

        private Builder() {
        }

        public Builder keyword(String keyword) {
            this.keyword = keyword;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(Status status) {
            this.status = status;
            return this;
        }

        public Builder deadline(String deadline) {
            this.deadline = DeadlineInput.of(deadline);
            return this;
        }

        public Builder sort(QuerySort sort) {
            this.sort = sort;
            return this;
        }

        public Builder limit(Long limit) {
            this.limit = ResultLimit.of(limit);
            return this;
        }

        public Builder limit(long limit) {
            return limit(Long.valueOf(limit));
        }

        public Query build() {
            return new Query(keyword, priority, status, deadline, sort, limit);
        }
    }
}
