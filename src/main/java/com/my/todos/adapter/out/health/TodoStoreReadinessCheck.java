package com.my.todos.adapter.out.health;

import com.my.todos.adapter.in.api.TodoApi;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class TodoStoreReadinessCheck implements HealthCheck {

    private final TodoApi todoApi;

    public TodoStoreReadinessCheck(TodoApi todoApi) {
        this.todoApi = todoApi;
    }

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("todo-store-readiness")
                .withData("componentVersion", todoApi.meta().componentVersion())
                .withData("todoCount", todoApi.countAll())
                .up()
                .build();
    }
}
