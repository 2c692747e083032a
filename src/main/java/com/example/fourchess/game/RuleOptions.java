package com.example.fourchess.game;

/**
 * Optional rules. A draw limit of zero switches that rule off; team play is off unless asked for.
 */
public final class RuleOptions {

    public static final RuleOptions DEFAULT = new RuleOptions(0, 0);

    /** Same position seen this many times ends the game in a draw. */
    public final int repetitionLimit;
    /** This many plies in a row without capture or pawn move ends the game in a draw. */
    public final int noProgressPlies;
    /**
     * Red plays with Yellow and Blue with Green. Partners neither capture nor check each other,
     * and a team wins once no live opponent is left.
     */
    public final boolean teams;

    public RuleOptions(int repetitionLimit, int noProgressPlies) {
        this(repetitionLimit, noProgressPlies, false);
    }

    public RuleOptions(int repetitionLimit, int noProgressPlies, boolean teams) {
        if (repetitionLimit < 0 || noProgressPlies < 0) {
            throw new IllegalArgumentException("Draw limits must not be negative");
        }
        this.repetitionLimit = repetitionLimit;
        this.noProgressPlies = noProgressPlies;
        this.teams = teams;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RuleOptions r && r.repetitionLimit == repetitionLimit
                && r.noProgressPlies == noProgressPlies && r.teams == teams;
    }

    @Override
    public int hashCode() {
        return (repetitionLimit * 31 + noProgressPlies) * 31 + (teams ? 1 : 0);
    }

    @Override
    public String toString() {
        return "RuleOptions{repetitionLimit=" + repetitionLimit + ", noProgressPlies=" + noProgressPlies
                + ", teams=" + teams + "}";
    }
}
