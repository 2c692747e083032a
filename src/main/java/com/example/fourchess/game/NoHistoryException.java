package com.example.fourchess.game;

public class NoHistoryException extends FourChessException {

    public NoHistoryException() {
        super("No move to undo");
    }
}
