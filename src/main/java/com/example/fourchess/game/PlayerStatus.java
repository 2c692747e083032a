package com.example.fourchess.game;

/**
 * Mutable per-game state of one player. Only {@link TurnManager} changes it.
 */
public final class PlayerStatus {

    boolean eliminated;
    int score;

    public PlayerStatus() {
    }

    public PlayerStatus(boolean eliminated, int score) {
        this.eliminated = eliminated;
        this.score = score;
    }

    public boolean isEliminated() {
        return eliminated;
    }

    public int getScore() {
        return score;
    }

    PlayerStatus copy() {
        return new PlayerStatus(eliminated, score);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PlayerStatus s && s.eliminated == eliminated && s.score == score;
    }

    @Override
    public int hashCode() {
        return (eliminated ? 1 : 0) * 31 + score;
    }

    @Override
    public String toString() {
        return (eliminated ? "eliminated" : "alive") + "/" + score;
    }
}
