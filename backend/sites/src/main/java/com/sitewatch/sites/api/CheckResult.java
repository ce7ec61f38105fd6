package com.sitewatch.sites.api;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

public record CheckResult(boolean success, String error, List<String> messages) {
    public CheckResult {
        error = error == null ? "" : error;
        messages = messages == null ? List.of() : List.copyOf(messages);
        if (!success && !messages.isEmpty()) {
            throw new IllegalArgumentException("A failed check carries no messages");
        }
    }

    public static CheckResult success(List<String> messages) {
        return new CheckResult(true, "", Objects.requireNonNull(messages, "messages is required"));
    }

    public static CheckResult noUpdates() {
        return new CheckResult(true, "", List.of());
    }

    public static CheckResult failure(String error) {
        return new CheckResult(false, error, List.of());
    }

    /** Failure describing an exception, with future wrappers peeled off. */
    public static CheckResult failure(Throwable error) {
        return failure(describe(error));
    }

    public static Throwable unwrap(Throwable throwable) {
        Throwable error = throwable;
        while ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null) {
            error = error.getCause();
        }
        return error;
    }

    private static String describe(Throwable throwable) {
        Throwable error = unwrap(throwable);
        if (error instanceof TimeoutException) {
            return "Upstream request timed out";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
