package com.leyesmx.application.conversion;

public class StatuteConversionException extends RuntimeException {

    public StatuteConversionException(String message) {
        super(message);
    }

    public StatuteConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
