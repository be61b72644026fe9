package com.codeabbrev.core.transform;

/**
 * Unexpected failure while rewriting a node.
 */
public class TransformException extends RuntimeException {

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
