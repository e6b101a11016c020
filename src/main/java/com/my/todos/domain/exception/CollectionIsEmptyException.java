package com.my.todos.domain.exception;

/**
 * 왜: 일괄 삭제 대상 집합이 비어 있으면 아무 것도 지우지 않는 호출을 조용히 통과시키지 않고 경계에서 거부하기 위함.
 */
public class CollectionIsEmptyException extends TodoException {

    public CollectionIsEmptyException(String target) {
        super(ErrorKind.COLLECTION_IS_EMPTY, "The set of " + target + " to delete cannot be empty.");
    }
}
