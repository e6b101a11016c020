package com.my.todos.adapter.in.api;

import com.my.todos.config.AppConfig;
import com.my.todos.domain.model.Priority;
import com.my.todos.domain.model.Status;
import com.my.todos.domain.model.Todo;
import com.my.todos.domain.port.in.TodoUseCase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 왜: 외부 계약(DTO, 문자열 id, 64비트 개수)을 도메인 저장소 계약으로 변환하고,
 * 동기화가 없는 저장소 인스턴스 하나에 대한 모든 접근을 단일 락으로 직렬화하기 위함.
 */
@ApplicationScoped
public class TodoApi {

    private final TodoUseCase todoUseCase;
    private final AppConfig appConfig;
    private final ReentrantLock lock = new ReentrantLock();

    @Inject
    public TodoApi(TodoUseCase todoUseCase, AppConfig appConfig) {
        this.todoUseCase = todoUseCase;
        this.appConfig = appConfig;
    }

    public TodoDto add(NewTodoDto item) {
        return exclusive(() -> TodoDtoMapper.toWire(todoUseCase.add(TodoDtoMapper.toDomain(item))));
    }

    public TodoDto update(String id, UpdateTodoDto change) {
        return exclusive(() -> {
            UUID parsed = TodoDtoMapper.parseId(id);
            return TodoDtoMapper.toWire(todoUseCase.update(parsed, TodoDtoMapper.toDomain(change)));
        });
    }

    public List<TodoDto> search(QueryDto query) {
        return exclusive(() -> todoUseCase.search(TodoDtoMapper.toDomain(query)).stream()
                .map(TodoDtoMapper::toWire)
                .toList());
    }

    public long countBy(FilterDto filter) {
        return exclusive(() -> TodoDtoMapper.toWireCount(todoUseCase.countBy(TodoDtoMapper.toDomain(filter))));
    }

    public long countAll() {
        return exclusive(() -> TodoDtoMapper.toWireCount(todoUseCase.countAll()));
    }

    public TodoDto get(String id) {
        return exclusive(() -> {
            Todo todo = todoUseCase.get(TodoDtoMapper.parseId(id));
            return TodoDtoMapper.toWire(todo);
        });
    }

    public void delete(String id) {
        exclusive(() -> {
            todoUseCase.delete(TodoDtoMapper.parseId(id));
            return null;
        });
    }

    public long deleteDoneItems() {
        return exclusive(() -> TodoDtoMapper.toWireCount(todoUseCase.deleteByStatus(Status.DONE)));
    }

    public long deleteByStatuses(Collection<StatusDto> statuses) {
        return exclusive(() -> {
            Set<Status> targets = new LinkedHashSet<>();
            statuses.forEach(status -> targets.add(TodoDtoMapper.toDomain(status)));
            return TodoDtoMapper.toWireCount(todoUseCase.deleteByStatuses(targets));
        });
    }

    public long deleteByPriorities(Collection<PriorityDto> priorities) {
        return exclusive(() -> {
            Set<Priority> targets = new LinkedHashSet<>();
            priorities.forEach(priority -> targets.add(TodoDtoMapper.toDomain(priority)));
            return TodoDtoMapper.toWireCount(todoUseCase.deleteByPriorities(targets));
        });
    }

    public long deleteByIds(Collection<String> ids) {
        return exclusive(() -> {
            Set<UUID> targets = new LinkedHashSet<>();
            ids.forEach(id -> targets.add(TodoDtoMapper.parseId(id)));
            return TodoDtoMapper.toWireCount(todoUseCase.deleteByIds(targets));
        });
    }

    public long deleteAll() {
        return exclusive(() -> TodoDtoMapper.toWireCount(todoUseCase.deleteAll()));
    }

    public MetaDataDto meta() {
        return new MetaDataDto(appConfig.meta().componentVersion(), appConfig.meta().schemaVersion());
    }

    private <T> T exclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
