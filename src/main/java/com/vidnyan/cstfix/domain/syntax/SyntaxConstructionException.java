package com.vidnyan.cstfix.domain.syntax;

/**
 * Thrown when a token, trivia piece or node is built with content its kind does not allow.
 * Signals a bug in the caller, never bad input.
 */
public class SyntaxConstructionException extends IllegalArgumentException {

    public SyntaxConstructionException(String message) {
        super(message);
    }
}
