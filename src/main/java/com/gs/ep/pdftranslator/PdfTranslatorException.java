package com.gs.ep.pdftranslator;

/**
 * Base of the unchecked failures raised while translating a document.
 */
public class PdfTranslatorException extends RuntimeException {

    public PdfTranslatorException(String message) {
        super(message);
    }

    public PdfTranslatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
