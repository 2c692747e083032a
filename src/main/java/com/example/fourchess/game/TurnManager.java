package com.example.fourchess.game;

import com.example.fourchess.game.FourChessRules.*;
import com.example.fourchess.game.IllegalMoveException.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plays and takes back plies on a {@link GameState}: validates against the legal moves, mutates
 * the board, keeps scores, eliminates checkmated players, passes the turn to the next live player
 * and decides the outcome. A rejected request changes nothing.
 */
final class TurnManager {

    private static final Logger log = LoggerFactory.getLogger(TurnManager.class);

    private TurnManager() {
    }

    static void apply(GameState s, Move request) throws GameAlreadyFinishedException, IllegalMoveException {
        if (s.outcome.isFinished()) {
            throw new GameAlreadyFinishedException(s.outcome);
        }
        Move move = resolve(s, request);
        Player mover = s.active;

        List<Pos> cleared = new ArrayList<>();
        for (Map.Entry<Pos, Piece> e : s.board.pieces()) {
            if (e.getValue().enPassant) cleared.add(e.getKey());
        }
        GameState.Ply ply = new GameState.Ply(move, mover, cleared, GameState.copyStatuses(s.statuses),
                s.outcome, s.noProgress);

        // stale en passant flags expire at the ply boundary
        for (Pos p : cleared) s.board.set(p, s.board.at(p).withEnPassant(false));
        s.board.apply(move);

        PlayerStatus moverStatus = s.statuses.get(mover);
        if (move.captured != null && !s.statuses.get(move.captured.owner).eliminated) {
            moverStatus.score += move.captured.type.points;
        }
        s.noProgress = move.captured != null || move.piece.type == PieceType.PAWN ? 0 : s.noProgress + 1;

        // a partner can be left mated by a discovered line too; it is eliminated but earns nothing
        for (Player p = mover.next(); p != mover; p = p.next()) {
            if (s.statuses.get(p).eliminated) continue;
            if (CheckEvaluator.isCheckmated(s, p)) {
                s.statuses.get(p).eliminated = true;
                if (!s.areAllies(mover, p)) moverStatus.score += CheckEvaluator.CHECKMATE_POINTS;
                ply.eliminated.add(p);
                log.info("{} checkmated by {} after {}", p, mover, move);
            }
        }

        s.active = nextActive(s, mover);
        String key = GameSnapshotCodec.positionKey(s);
        ply.positionKey = key;
        int seen = s.positionCounts.merge(key, 1, Integer::sum);
        s.outcome = terminalOutcome(s);
        if (!s.outcome.isFinished()) {
            if (s.options.repetitionLimit > 0 && seen >= s.options.repetitionLimit) {
                s.outcome = Outcome.draw(Outcome.Result.DRAW_REPETITION);
            } else if (s.options.noProgressPlies > 0 && s.noProgress >= s.options.noProgressPlies) {
                s.outcome = Outcome.draw(Outcome.Result.DRAW_NO_PROGRESS);
            }
        }
        s.history.add(ply);

        log.debug("{} played {}, {} to move", mover, move, s.active);
        if (s.outcome.isFinished()) {
            log.info("Game over after {} plies: {}", s.history.size(), s.outcome.getDescription());
        }
    }

    static void undo(GameState s) throws NoHistoryException {
        if (s.history.isEmpty()) {
            throw new NoHistoryException();
        }
        GameState.Ply ply = s.history.remove(s.history.size() - 1);
        s.positionCounts.computeIfPresent(ply.positionKey, (k, n) -> n > 1 ? n - 1 : null);

        s.board.undo(ply.move);
        for (Pos p : ply.clearedEnPassant) s.board.set(p, s.board.at(p).withEnPassant(true));

        s.statuses.clear();
        s.statuses.putAll(GameState.copyStatuses(ply.statusesBefore));
        s.active = ply.mover;
        s.outcome = ply.outcomeBefore;
        s.noProgress = ply.noProgressBefore;
        log.debug("Took back {} by {}", ply.move, ply.mover);
    }

    /**
     * Eliminate every live player already checkmated on the board, for positions set up from
     * outside. Nobody is credited.
     *
     * @return whether anyone was eliminated
     */
    static boolean eliminateCheckmated(GameState s) {
        boolean any = false;
        for (Player p : Player.values()) {
            if (s.statuses.get(p).eliminated) continue;
            if (CheckEvaluator.isCheckmated(s, p)) {
                s.statuses.get(p).eliminated = true;
                any = true;
                log.info("{} is already checkmated in the set-up position", p);
            }
        }
        return any;
    }

    /**
     * Next player after {@code from} in turn order, skipping eliminated players
     */
    static Player nextActive(GameState s, Player from) {
        for (Player p = from.next(); p != from; p = p.next()) {
            if (!s.statuses.get(p).eliminated) return p;
        }
        return from;
    }

    /**
     * Last player standing wins, in team play the last team standing; a stalemated active player
     * draws the game.
     */
    static Outcome terminalOutcome(GameState s) {
        List<Player> live = s.livePlayers();
        if (live.size() <= 1) {
            return Outcome.win(live.isEmpty() ? s.active : live.get(0));
        }
        if (live.size() == 2 && s.areAllies(live.get(0), live.get(1))) {
            return Outcome.teamWin(live.get(0));
        }
        if (CheckEvaluator.isStalemated(s, s.active)) {
            return Outcome.draw(Outcome.Result.DRAW_STALEMATE);
        }
        return Outcome.IN_PROGRESS;
    }

    private static Move resolve(GameState s, Move request) throws IllegalMoveException {
        for (Move m : MoveGenerator.legalMoves(s, s.active)) {
            if (m.equals(request)) return m;
        }
        throw new IllegalMoveException(request, diagnose(s, request));
    }

    /**
     * Name the first rule an illegal request breaks
     */
    static Violation diagnose(GameState s, Move request) {
        Board b = s.board;
        if (!Board.onBoard(request.from) || !Board.onBoard(request.to)) return Violation.OUT_OF_BOUNDS;
        Piece piece = b.at(request.from);
        if (piece == null) return Violation.NO_PIECE;
        if (piece.owner != s.active) return Violation.WRONG_TURN;
        Piece target = b.at(request.to);
        if (target != null && target.owner == piece.owner) return Violation.OCCUPIED_BY_OWN_PIECE;
        // generated moves never take a king, so test the capture pattern directly
        if (target != null && target.type == PieceType.KING) {
            return piece.attacks(b, request.from, request.to) ? Violation.KING_CAPTURE : Violation.NOT_PIECE_PATTERN;
        }

        List<Move> pseudo = new ArrayList<>();
        piece.pseudoLegalMoves(b, request.from, pseudo);
        Move sameSquares = null;
        for (Move m : pseudo) {
            if (m.equals(request)) {
                if (m.captured != null && s.areAllies(piece.owner, m.captured.owner)) return Violation.ALLY_CAPTURE;
                if (m.isCastle() && !MoveGenerator.castlingPathSafe(b, m, s.opponentsOf(piece.owner))) {
                    return Violation.CASTLING_THROUGH_CHECK;
                }
                return Violation.LEAVES_KING_IN_CHECK;
            }
            if (m.from.equals(request.from) && m.to.equals(request.to)) sameSquares = m;
        }
        return sameSquares != null ? Violation.INVALID_PROMOTION : Violation.NOT_PIECE_PATTERN;
    }
}
