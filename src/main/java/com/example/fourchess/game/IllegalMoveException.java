package com.example.fourchess.game;

import com.example.fourchess.game.FourChessRules.Move;

/**
 * A move request that is not among the active player's legal moves.
 */
public class IllegalMoveException extends FourChessException {

    public enum Violation {
        OUT_OF_BOUNDS("Square is not on the board"),
        NO_PIECE("There is no piece on the start square"),
        WRONG_TURN("It is not this player's turn"),
        OCCUPIED_BY_OWN_PIECE("Target square holds one of the player's own pieces"),
        KING_CAPTURE("Kings cannot be captured"),
        ALLY_CAPTURE("Pieces of a partner cannot be captured"),
        NOT_PIECE_PATTERN("The piece does not move like that"),
        INVALID_PROMOTION("Promotion piece missing or not allowed here"),
        CASTLING_THROUGH_CHECK("The king would castle out of, through or into an attacked square"),
        LEAVES_KING_IN_CHECK("Move leaves the player's king in check");

        private final String description;

        Violation(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final transient Move move;
    private final Violation violation;

    public IllegalMoveException(Move move, Violation violation) {
        super("Illegal move " + move + ": " + violation.getDescription());
        this.move = move;
        this.violation = violation;
    }

    public Move getMove() {
        return move;
    }

    public Violation getViolation() {
        return violation;
    }
}
