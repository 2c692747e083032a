package com.example.fourchess.game;

import com.example.fourchess.game.FourChessRules.*;

/**
 * Check, checkmate and stalemate of a single player on the current board. Only the pieces of live
 * players threaten anything; an eliminated player's pieces are plain obstacles.
 */
public final class CheckEvaluator {

    /** Points credited to the player whose move checkmates another. */
    public static final int CHECKMATE_POINTS = 20;

    private CheckEvaluator() {
    }

    /**
     * Check if the player's king is attacked by some other live player
     */
    public static boolean inCheck(GameState state, Player player) {
        Pos king = state.board.findKing(player);
        if (king == null) return false;
        return AttackMap.isAttackedByAny(state.board, king, state.opponentsOf(player));
    }

    /**
     * Check if checkmated: in check and no move gets out of it
     */
    public static boolean isCheckmated(GameState state, Player player) {
        // 1. Check if currently in check
        if (!inCheck(state, player)) {
            return false;
        }

        // 2. Check if any legal moves can escape check
        return !hasLegalMoves(state, player);
    }

    /**
     * Check for stalemate (no legal moves but not in check)
     */
    public static boolean isStalemated(GameState state, Player player) {
        if (inCheck(state, player)) {
            return false;
        }
        return !hasLegalMoves(state, player);
    }

    /**
     * Check if specified player has any legal moves
     */
    public static boolean hasLegalMoves(GameState state, Player player) {
        return MoveGenerator.hasLegalMove(state, player);
    }
}
