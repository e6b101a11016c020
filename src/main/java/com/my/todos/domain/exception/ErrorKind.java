package com.my.todos.domain.exception;

/**
 * 왜: 실패 종류를 호출자가 분기할 수 있는 닫힌 집합으로 고정하고, 메시지 접두어 표기를 한 곳에서 관리하기 위함.
 */
public enum ErrorKind {
    COLLECTION_IS_EMPTY("CollectionIsEmpty"),
    DATA_CONVERSION_U32_TO_USIZE("DataConversionU32ToUsize"),
    DATA_CONVERSION_USIZE_TO_U64("DataConversionUsizeToU64"),
    DATE_TIME_PARSE_ERROR("DateTimeParseError"),
    EMPTY_TODO_TITLE("EmptyTodoTitle"),
    INVALID_UUID("InvalidUuid"),
    TOO_LONG_TODO_TITLE("TooLongTodoTitle"),
    TODO_NOT_FOUND("TodoNotFound"),
    UPDATE_HAS_NO_CHANGES("UpdateHasNoChanges");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
