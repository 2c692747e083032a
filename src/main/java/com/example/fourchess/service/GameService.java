package com.example.fourchess.service;

import com.example.fourchess.game.*;
import com.example.fourchess.game.FourChessRules.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.Set;

/**
 * Owns the one canonical game of this server. Every method is synchronized, so at most one
 * mutation is in flight and readers never see a half-applied ply.
 */
@Service
public class GameService {

    private static final Logger log = LoggerFactory.getLogger(GameService.class);

    @Value("${fourchess.draw.repetition-limit:0}")
    private int repetitionLimit;

    @Value("${fourchess.draw.no-progress-plies:0}")
    private int noProgressPlies;

    @Value("${fourchess.teams:false}")
    private boolean teams;

    private GameState game;

    @PostConstruct
    public void start() {
        newGame();
    }

    public RuleOptions ruleOptions() {
        return new RuleOptions(repetitionLimit, noProgressPlies, teams);
    }

    public synchronized GameStatus newGame() {
        game = GameState.newGame(ruleOptions());
        log.info("New game started with {}", game.getOptions());
        return game.status();
    }

    public synchronized Set<Move> legalMoves(Pos from) {
        return game.legalMoves(from);
    }

    public synchronized GameStatus applyMove(Move move) throws IllegalMoveException, GameAlreadyFinishedException {
        game.applyMove(move);
        return game.status();
    }

    public synchronized GameStatus undo() throws NoHistoryException {
        game.undoLastMove();
        return game.status();
    }

    public synchronized GameStatus status() {
        return game.status();
    }

    public synchronized String board() {
        return GameSnapshotCodec.encodeBoard(game.getBoard());
    }

    public synchronized int historySize() {
        return game.getHistory().size();
    }

    public synchronized String snapshot() {
        return GameSnapshotCodec.encode(game);
    }

    /**
     * Replace the current game with one read from a snapshot. The current game stays if the
     * snapshot is rejected.
     */
    public synchronized GameStatus load(String snapshot) throws SnapshotFormatException {
        GameState loaded = GameSnapshotCodec.decode(snapshot);
        game = loaded;
        log.info("Loaded snapshot with {} plies, {} to move", loaded.getHistory().size(), loaded.getActivePlayer());
        return game.status();
    }
}
