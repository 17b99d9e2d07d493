package com.delta.linktools.check.util;

public final class ErrorMessages {
    private ErrorMessages() {
    }

    public static String truncate(String message, int maxLength) {
        if (message == null) {
            return null;
        }
        return message.length() <= maxLength ? message : message.substring(0, maxLength);
    }

    public static String describe(Throwable error, int maxLength) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            message = error.getClass().getSimpleName();
        }
        return truncate(message, maxLength);
    }
}
