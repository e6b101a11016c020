package com.my.todos.adapter.in.api;

public record MetaDataDto(String componentVersion, long schemaVersion) {
}
