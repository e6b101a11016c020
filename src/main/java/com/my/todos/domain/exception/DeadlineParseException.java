package com.my.todos.domain.exception;

/**
 * 왜: 사용자가 입력한 마감 시각 문자열과 기대 형식을 함께 돌려주어 호출자가 바로 교정 안내를 할 수 있게 하기 위함.
 */
public class DeadlineParseException extends TodoException {

    private final String input;
    private final String expectedFormat;

    public DeadlineParseException(String input, String expectedFormat, Throwable cause) {
        super(ErrorKind.DATE_TIME_PARSE_ERROR,
                "'" + input + "' is NOT in the required format of '" + expectedFormat + "'.", cause);
        this.input = input;
        this.expectedFormat = expectedFormat;
    }

    public String input() {
        return input;
    }

    public String expectedFormat() {
        return expectedFormat;
    }
}
