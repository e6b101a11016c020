package com.my.todos.domain.model;

import java.util.Optional;

/**
 * 왜: 부분 수정 요청을 표현한다. title/priority/status는 null이면 "변경 없음"이지만,
 * deadline은 매 수정마다 다시 해석되어 저장값을 덮어쓴다(원시 값이 없으면 마감 시각을 지운다).
 */
public record UpdateTodo(Title title, Priority priority, Status status, DeadlineInput deadline) {

    public UpdateTodo {
        deadline = deadline == null ? DeadlineInput.none() : deadline;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Title> titleChange() {
        return Optional.ofNullable(title);
    }

    public Optional<Priority> priorityChange() {
        return Optional.ofNullable(priority);
    }

    public Optional<Status> statusChange() {
        return Optional.ofNullable(status);
    }

    public boolean hasChanges() {
        return title != null || priority != null || status != null || deadline.isPresent();
    }

    public static final class Builder {
        private Title title;
        private Priority priority;
        private Status status;
        private DeadlineInput deadline = DeadlineInput.none();

        private Builder() {
        }

        public Builder title(String title) {
            this.title = title == null ? null : Title.of(title);
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

        public UpdateTodo build() {
            return new UpdateTodo(title, priority, status, deadline);
        }
    }
}
