package com.festival.content;

/**
 * Контент не прошел проверку при загрузке
 */
public class ContentInvalidException extends RuntimeException {

    public ContentInvalidException(String message) {
        super(message);
    }

    public ContentInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
