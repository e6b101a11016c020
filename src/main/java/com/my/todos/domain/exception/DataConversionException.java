package com.my.todos.domain.exception;

public class DataConversionException extends TodoException {

    private DataConversionException(ErrorKind kind, String description, Throwable cause) {
        super(kind, description, cause);
    }

    public static DataConversionException u32ToUsize(long value, Throwable cause) {
        return new DataConversionException(ErrorKind.DATA_CONVERSION_U32_TO_USIZE,
                "Error converting " + value + " to an index size.", cause);
    }

    public static DataConversionException usizeToU64(long value) {
        return new DataConversionException(ErrorKind.DATA_CONVERSION_USIZE_TO_U64,
                "Error converting " + value + " to unsigned-64.", null);
    }
}
