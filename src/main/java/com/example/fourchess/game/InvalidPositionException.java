package com.example.fourchess.game;

import com.example.fourchess.game.FourChessRules.Pos;

/**
 * Write to a coordinate outside the cross-shaped board. Callers must filter with
 * {@link FourChessRules.Board#onBoard(Pos)} first, so this is a programming error.
 */
public class InvalidPositionException extends IllegalArgumentException {

    public InvalidPositionException(Pos position) {
        super("Square " + position + " (" + position.file + "," + position.rank + ") is not on the board");
    }
}
