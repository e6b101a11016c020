package com.my.todos.domain.port.in;

import com.my.todos.domain.model.NewTodo;
import com.my.todos.domain.model.Priority;
import com.my.todos.domain.model.Query;
import com.my.todos.domain.model.Status;
import com.my.todos.domain.model.Todo;
import com.my.todos.domain.model.UpdateTodo;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * 왜: 할 일 저장소의 프로세스 내부 계약을 한 인터페이스로 고정해 어댑터가 구현 세부사항에 묶이지 않게 하기 위함.
 * 실패는 {@link com.my.todos.domain.exception.TodoException} 하위 타입으로 호출자에게 그대로 전달된다.
 * 구현체는 내부 동기화를 하지 않으므로 동시 접근은 호출 측이 직렬화해야 한다.
 */
public interface TodoUseCase {

    Todo add(NewTodo item);

    Todo update(UUID id, UpdateTodo change);

    List<Todo> search(Query query);

    int countBy(Query query);

    int countAll();

    Todo get(UUID id);

    void delete(UUID id);

    int deleteByIds(Set<UUID> ids);

    int deleteByPriorities(Set<Priority> priorities);

    int deleteByStatuses(Set<Status> statuses);

    int deleteByStatus(Status status);

    int deleteAll();
}
