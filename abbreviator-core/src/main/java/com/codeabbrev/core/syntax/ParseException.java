package com.codeabbrev.core.syntax;

/**
 * Raised when source text is not valid Python at the statement level.
 */
public class ParseException extends Exception {

    private final int lineNumber;

    public ParseException(String message, int lineNumber) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }

    /** 1-based physical line where the error was detected. */
    public int getLineNumber() { return lineNumber; }
}
