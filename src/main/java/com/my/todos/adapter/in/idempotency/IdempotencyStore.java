package com.my.todos.adapter.in.idempotency;

public interface IdempotencyStore {

    boolean isProcessed(String commandId);

    void markProcessed(String commandId);
}
