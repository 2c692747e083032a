package com.example.fourchess.game;

/**
 * Snapshot text that cannot be turned back into a game.
 */
public class SnapshotFormatException extends FourChessException {

    public SnapshotFormatException(String message) {
        super(message);
    }

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
