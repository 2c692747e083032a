package com.example.fourchess.game;

import com.example.fourchess.game.FourChessRules.Player;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Read-only view of a game for renderers and search code.
 */
public final class GameStatus {

    public static final class PlayerView {
        public final Player player;
        public final boolean inCheck;
        public final boolean eliminated;
        public final int score;

        public PlayerView(Player player, boolean inCheck, boolean eliminated, int score) {
            this.player = player;
            this.inCheck = inCheck;
            this.eliminated = eliminated;
            this.score = score;
        }
    }

    public final Player activePlayer;
    public final Map<Player, PlayerView> players;
    public final Outcome outcome;

    public GameStatus(Player activePlayer, Map<Player, PlayerView> players, Outcome outcome) {
        this.activePlayer = activePlayer;
        this.players = Collections.unmodifiableMap(new EnumMap<>(players));
        this.outcome = outcome;
    }

    public PlayerView of(Player player) {
        return players.get(player);
    }
}
