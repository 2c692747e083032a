package com.example.fourchess.game;

import com.example.fourchess.game.FourChessRules.*;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Squares threatened by a player. Works from the piece rules directly and never asks
 * {@link MoveGenerator}, which depends on it for the self-check test.
 */
public final class AttackMap {

    private AttackMap() {
    }

    /**
     * Union of the capture targets of every piece owned by {@code attacker}. Pawns contribute their
     * two forward diagonals only; sliders stop at (and include) the first occupied square.
     */
    public static Set<Pos> attackedSquares(Board board, Player attacker) {
        Set<Pos> out = new HashSet<>();
        for (Map.Entry<Pos, Piece> e : board.pieces()) {
            if (e.getValue().owner == attacker) e.getValue().attackedSquares(board, e.getKey(), out);
        }
        return out;
    }

    public static boolean isAttacked(Board board, Pos target, Player attacker) {
        for (Map.Entry<Pos, Piece> e : board.pieces()) {
            Piece p = e.getValue();
            if (p.owner == attacker && p.attacks(board, e.getKey(), target)) return true;
        }
        return false;
    }

    /** Whether any of {@code attackers} threatens {@code target}. */
    public static boolean isAttackedByAny(Board board, Pos target, Collection<Player> attackers) {
        for (Map.Entry<Pos, Piece> e : board.pieces()) {
            Piece p = e.getValue();
            if (attackers.contains(p.owner) && p.attacks(board, e.getKey(), target)) return true;
        }
        return false;
    }
}
