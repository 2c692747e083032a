package com.example.fourchess.game;

import com.example.fourchess.game.FourChessRules.Player;

import java.util.Objects;

/**
 * Game outcome: in progress, won by the last player standing, or drawn.
 */
public final class Outcome {

    public enum Result {
        IN_PROGRESS("In progress"),
        WIN("Last player standing"),
        TEAM_WIN("Last team standing"),
        DRAW_STALEMATE("Draw (stalemate)"),
        DRAW_REPETITION("Draw (repetition)"),
        DRAW_NO_PROGRESS("Draw (no capture or pawn move)");

        private final String description;

        Result(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    public static final Outcome IN_PROGRESS = new Outcome(Result.IN_PROGRESS, null);

    private final Result result;
    private final Player winner;

    private Outcome(Result result, Player winner) {
        this.result = result;
        this.winner = winner;
    }

    public static Outcome win(Player winner) {
        return new Outcome(Result.WIN, Objects.requireNonNull(winner));
    }

    /** Win for {@code player} and its partner in team play. */
    public static Outcome teamWin(Player player) {
        return new Outcome(Result.TEAM_WIN, Objects.requireNonNull(player));
    }

    public static Outcome draw(Result result) {
        if (result == Result.WIN || result == Result.TEAM_WIN || result == Result.IN_PROGRESS) {
            throw new IllegalArgumentException("Not a draw: " + result);
        }
        return new Outcome(result, null);
    }

    public Result getResult() {
        return result;
    }

    /** Winner (for a team win, the first live player of the team), or null for other results. */
    public Player getWinner() {
        return winner;
    }

    public boolean isFinished() {
        return result != Result.IN_PROGRESS;
    }

    public String getDescription() {
        if (winner == null) return result.getDescription();
        return result == Result.TEAM_WIN ? winner + " and " + winner.ally() + " win" : winner + " wins";
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Outcome other)) return false;
        return other.result == result && other.winner == winner;
    }

    @Override
    public int hashCode() {
        return Objects.hash(result, winner);
    }

    @Override
    public String toString() {
        return winner == null ? result.name() : result.name() + ":" + winner.letter;
    }
}
