package com.gs.ep.pdftranslator.translate;

/**
 * Outcome of one call to a {@link Translator}. A failure is a value, not an
 * exception, so callers decide between retrying and falling back.
 */
public final class TranslationResult {

    public enum Status {
        SUCCESS,
        /**
         * Transient failure (timeout, rate limit, server error); the same request may succeed later.
         */
        RETRYABLE,
        FATAL
    }

    private final Status status;
    private final String text;
    private final String error;

    private TranslationResult(Status status, String text, String error) {
        this.status = status;
        this.text = text;
        this.error = error;
    }

    public static TranslationResult success(String text) {
        return new TranslationResult(Status.SUCCESS, text, null);
    }

    public static TranslationResult retryable(String error) {
        return new TranslationResult(Status.RETRYABLE, null, error);
    }

    public static TranslationResult fatal(String error) {
        return new TranslationResult(Status.FATAL, null, error);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isRetryable() {
        return status == Status.RETRYABLE;
    }

    /**
     * Translated text; null unless the call succeeded.
     */
    public String getText() {
        return text;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "SUCCESS[" + text + "]" : status + "[" + error + "]";
    }
}
