package com.my.todos.domain.service;

import com.my.todos.domain.exception.CollectionIsEmptyException;
import com.my.todos.domain.exception.TodoNotFoundException;
import com.my.todos.domain.exception.UpdateHasNoChangesException;
import com.my.todos.domain.model.NewTodo;
import com.my.todos.domain.model.Priority;
import com.my.todos.domain.model.Query;
import com.my.todos.domain.model.SortKey;
import com.my.todos.domain.model.Status;
import com.my.todos.domain.model.Title;
import com.my.todos.domain.model.Todo;
import com.my.todos.domain.model.UpdateTodo;
import com.my.todos.domain.port.in.TodoUseCase;
import com.my.todos.domain.port.out.ClockPort;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * 왜: 할 일 레코드를 id로 보관하는 단일 인메모리 저장소로, 모든 변경을 이 클래스의 연산으로만 일으키기 위함.
 * 전역 인스턴스를 두지 않고 호출 측이 생성해 소유하며, 내부 동기화는 하지 않는다.
 */
public class TodoStore implements TodoUseCase {

    private final Map<UUID, Todo> todos = new LinkedHashMap<>();
    private final ClockPort clockPort;

    public TodoStore(ClockPort clockPort) {
        this.clockPort = clockPort;
    }

    @Override
    public Todo add(NewTodo item) {
        // 마감 시각을 먼저 해석하므로 두 입력이 모두 잘못되면 마감 시각 오류가 보고된다.
        Long deadline = item.deadline().resolve().orElse(null);
        String title = item.title().validate();

        UUID id = nextId();
        long now = clockPort.nowEpochSeconds();
        Todo todo = new Todo(id, title, item.priority(), Status.BACKLOG, now, now, deadline);
        todos.put(id, todo);
        return todo;
    }

    @Override
    public Todo update(UUID id, UpdateTodo change) {
        if (!change.hasChanges()) {
            throw new UpdateHasNoChangesException();
        }
        // id 조회 전에 해석해야 잘못된 마감 시각이 TodoNotFound보다 먼저 보고된다.
        Long deadline = change.deadline().resolve().orElse(null);

        Todo current = todos.get(id);
        if (current == null) {
            throw new TodoNotFoundException(id);
        }

        String title = change.titleChange().map(Title::validate).orElse(current.title());
        Priority priority = change.priorityChange().orElse(current.priority());
        Status status = change.statusChange().orElse(current.status());

        boolean modified = !title.equals(current.title())
                || priority != current.priority()
                || status != current.status()
                || !Objects.equals(deadline, current.deadline());
        if (!modified) {
            return current;
        }

        long updatedAt = Math.max(current.updatedTimestamp(), clockPort.nowEpochSeconds());
        Todo updated = new Todo(id, title, priority, status, current.createdTimestamp(), updatedAt, deadline);
        todos.put(id, updated);
        return updated;
    }

    @Override
    public List<Todo> search(Query query) {
        Optional<Long> deadlineBound = query.deadline().resolve();
        int topN = query.limit().resolve();
        Comparator<Todo> order = SortKey.comparator(query.sortBy());

        BoundedTopN<Todo> selector = new BoundedTopN<>(topN, order);
        filterBy(query, deadlineBound).forEach(selector::offer);
        return selector.toSortedList();
    }

    @Override
    public int countBy(Query query) {
        Optional<Long> deadlineBound = query.deadline().resolve();
        return (int) filterBy(query, deadlineBound).count();
    }

    @Override
    public int countAll() {
        return todos.size();
    }

    @Override
    public Todo get(UUID id) {
        Todo todo = todos.get(id);
        if (todo == null) {
            throw new TodoNotFoundException(id);
        }
        return todo;
    }

    @Override
    public void delete(UUID id) {
        if (todos.remove(id) == null) {
            throw new TodoNotFoundException(id);
        }
    }

    @Override
    public int deleteByIds(Set<UUID> ids) {
        requireNonEmpty(ids, "ids");
        return deleteWhere(todo -> ids.contains(todo.id()));
    }

    @Override
    public int deleteByPriorities(Set<Priority> priorities) {
        requireNonEmpty(priorities, "priorities");
        return deleteWhere(todo -> priorities.contains(todo.priority()));
    }

    @Override
    public int deleteByStatuses(Set<Status> statuses) {
        requireNonEmpty(statuses, "statuses");
        return deleteWhere(todo -> statuses.contains(todo.status()));
    }

    @Override
    public int deleteByStatus(Status status) {
        return deleteByStatuses(Set.of(status));
    }

    @Override
    public int deleteAll() {
        int count = todos.size();
        todos.clear();
        return count;
    }

    private Stream<Todo> filterBy(Query query, Optional<Long> deadlineBound) {
        return todos.values().stream().filter(todo -> query.matches(todo, deadlineBound));
    }

    private int deleteWhere(Predicate<Todo> shouldDelete) {
        int before = todos.size();
        todos.values().removeIf(shouldDelete);
        return before - todos.size();
    }

    private UUID nextId() {
        UUID id = UUID.randomUUID();
        while (todos.containsKey(id)) {
            id = UUID.randomUUID();
        }
        return id;
    }

    private static void requireNonEmpty(Set<?> targets, String name) {
        if (targets == null || targets.isEmpty()) {
            throw new CollectionIsEmptyException(name);
        }
    }
}
