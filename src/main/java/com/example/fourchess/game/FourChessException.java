package com.example.fourchess.game;

/**
 * Base of every error a caller can correct. The game is left untouched when one is thrown.
 */
public abstract class FourChessException extends Exception {

    protected FourChessException(String message) {
        super(message);
    }

    protected FourChessException(String message, Throwable cause) {
        super(message, cause);
    }
}
