package com.example.fourchess.game;

import com.example.fourchess.game.FourChessRules.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Legal moves: pseudo-legal moves of the piece rules that keep the mover's king out of reach of
 * every other live player at once. Candidates are tried on scratch copies; the board passed in is
 * never modified.
 */
public final class MoveGenerator {

    private MoveGenerator() {
    }

    /** Legal moves of {@code player}; empty for an eliminated player. */
    public static Set<Move> legalMoves(GameState state, Player player) {
        if (state.getStatus(player).isEliminated()) return Collections.emptySet();
        return filter(state.board, player, state.opponentsOf(player), withoutAllyCaptures(state, player,
                pseudoLegalMoves(state.board, player)));
    }

    /** Legal moves of the piece on {@code from}, whoever owns it; empty for an empty square. */
    public static Set<Move> legalMoves(GameState state, Pos from) {
        Board board = state.board;
        Piece piece = Board.onBoard(from) ? board.at(from) : null;
        if (piece == null || state.getStatus(piece.owner).isEliminated()) return Collections.emptySet();
        List<Move> candidates = new ArrayList<>();
        piece.pseudoLegalMoves(board, from, candidates);
        return filter(board, piece.owner, state.opponentsOf(piece.owner),
                withoutAllyCaptures(state, piece.owner, candidates));
    }

    public static List<Move> pseudoLegalMoves(Board board, Player player) {
        List<Move> out = new ArrayList<>();
        for (Map.Entry<Pos, Piece> e : board.piecesOf(player).entrySet()) {
            e.getValue().pseudoLegalMoves(board, e.getKey(), out);
        }
        return out;
    }

    public static boolean hasLegalMove(GameState state, Player player) {
        if (state.getStatus(player).isEliminated()) return false;
        List<Player> opponents = state.opponentsOf(player);
        for (Move m : withoutAllyCaptures(state, player, pseudoLegalMoves(state.board, player))) {
            if (isSafe(state.board, m, player, opponents)) return true;
        }
        return false;
    }

    /** Drops captures of the partner's pieces in team play. */
    private static List<Move> withoutAllyCaptures(GameState state, Player player, List<Move> candidates) {
        if (!state.options.teams) return candidates;
        candidates.removeIf(m -> m.captured != null && state.areAllies(player, m.captured.owner));
        return candidates;
    }

    private static Set<Move> filter(Board board, Player player, Collection<Player> opponents, List<Move> candidates) {
        Set<Move> out = new LinkedHashSet<>();
        for (Move m : candidates) {
            if (isSafe(board, m, player, opponents)) out.add(m);
        }
        return out;
    }

    /**
     * Whether playing {@code m} leaves the king of {@code player} unattacked by all
     * {@code opponents}. Castling additionally needs the king's start and transit squares safe.
     */
    public static boolean isSafe(Board board, Move m, Player player, Collection<Player> opponents) {
        if (m.isCastle() && !castlingPathSafe(board, m, opponents)) return false;
        Board scratch = board.makeMove(m);
        Pos king = scratch.findKing(player);
        return king == null || !AttackMap.isAttackedByAny(scratch, king, opponents);
    }

    static boolean castlingPathSafe(Board board, Move m, Collection<Player> opponents) {
        if (AttackMap.isAttackedByAny(board, m.from, opponents)) return false;
        for (Pos p : board.squaresBetween(m.from, m.to)) {
            if (AttackMap.isAttackedByAny(board, p, opponents)) return false;
        }
        return !AttackMap.isAttackedByAny(board, m.to, opponents);
    }
}
