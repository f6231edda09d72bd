package com.seveninterprise.stackforge.exceptions;

/**
 * Exception customizada para operações sobre arquivos compose e templates
 */
public class ComposeException extends RuntimeException {

    public ComposeException(String message) {
        super(message);
    }

    public ComposeException(String message, Throwable cause) {
        super(message, cause);
    }
}
