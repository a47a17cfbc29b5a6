package com.tradelang.runner.translate;

/**
 * Natural language could not be turned into a strategy description.
 */
public class TranslationException extends Exception {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
