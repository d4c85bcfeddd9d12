package com.gs.ep.pdftranslator;

/**
 * The input could not be read as a PDF. Fatal for that file only.
 */
public class PdfFormatException extends PdfTranslatorException {

    public PdfFormatException(String message) {
        super(message);
    }

    public PdfFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
