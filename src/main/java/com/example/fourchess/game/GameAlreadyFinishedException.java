package com.example.fourchess.game;

public class GameAlreadyFinishedException extends FourChessException {

    private final transient Outcome outcome;

    public GameAlreadyFinishedException(Outcome outcome) {
        super("Game is already finished: " + outcome.getDescription());
        this.outcome = outcome;
    }

    public Outcome getOutcome() {
        return outcome;
    }
}
