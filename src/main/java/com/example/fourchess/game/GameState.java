package com.example.fourchess.game;

import com.example.fourchess.game.FourChessRules.*;

import java.util.*;

/**
 * One game: the board, the four players in fixed turn order, whose turn it is, the move history
 * and the outcome. This is the handle renderers and search code work through.
 *
 * <p>Not thread-safe. Read-only queries may run concurrently as long as no
 * {@link #applyMove(Move)} or {@link #undoLastMove()} is interleaved; exclusive access for
 * mutations is the caller's business. Search code exploring variations in parallel should use
 * {@link #copy()}.
 */
public final class GameState {

    /**
     * History entry: the move plus everything needed to take it back exactly.
     */
    static final class Ply {
        final Move move;
        final Player mover;
        final List<Pos> clearedEnPassant;
        final EnumMap<Player, PlayerStatus> statusesBefore;
        final Outcome outcomeBefore;
        final int noProgressBefore;
        final List<Player> eliminated = new ArrayList<>();
        String positionKey;

        Ply(Move move, Player mover, List<Pos> clearedEnPassant, EnumMap<Player, PlayerStatus> statusesBefore,
            Outcome outcomeBefore, int noProgressBefore) {
            this.move = move;
            this.mover = mover;
            this.clearedEnPassant = clearedEnPassant;
            this.statusesBefore = statusesBefore;
            this.outcomeBefore = outcomeBefore;
            this.noProgressBefore = noProgressBefore;
        }
    }

    final Board board;
    final EnumMap<Player, PlayerStatus> statuses;
    Player active;
    Outcome outcome;
    int noProgress;
    final List<Ply> history = new ArrayList<>();
    final Map<String, Integer> positionCounts = new HashMap<>();
    final RuleOptions options;

    // the position before the first history entry, kept for snapshots
    final Board startBoard;
    final EnumMap<Player, PlayerStatus> startStatuses;
    Player startActive;

    private GameState(Board board, EnumMap<Player, PlayerStatus> statuses, Player active, RuleOptions options) {
        this.board = board;
        this.statuses = statuses;
        this.active = active;
        this.options = options;
        this.outcome = Outcome.IN_PROGRESS;
        this.startBoard = board.copy();
        this.startStatuses = copyStatuses(statuses);
        this.startActive = active;
    }

    /**
     * New game from the standard layout, Red to move
     */
    public static GameState newGame() {
        return newGame(RuleOptions.DEFAULT);
    }

    public static GameState newGame(RuleOptions options) {
        EnumMap<Player, PlayerStatus> statuses = new EnumMap<>(Player.class);
        for (Player p : Player.values()) statuses.put(p, new PlayerStatus());
        GameState s = new GameState(Board.initial(), statuses, Player.RED, options);
        s.positionCounts.put(GameSnapshotCodec.positionKey(s), 1);
        return s;
    }

    /**
     * Game resumed from an arbitrary position. Every live player needs exactly one king and the
     * active player must be alive. Players already checkmated in the position are eliminated,
     * passing the turn on if the active player is one of them, and the outcome is worked out from
     * what is left (last player or team standing, or a stalemated active player).
     *
     * @throws IllegalArgumentException if the position breaks those rules
     */
    public static GameState resume(Board board, Map<Player, PlayerStatus> statuses, Player active, RuleOptions options) {
        EnumMap<Player, PlayerStatus> copy = new EnumMap<>(Player.class);
        for (Player p : Player.values()) {
            PlayerStatus st = statuses.get(p);
            copy.put(p, st == null ? new PlayerStatus() : st.copy());
        }
        if (copy.get(active).eliminated) {
            throw new IllegalArgumentException("Active player " + active + " is eliminated");
        }
        for (Player p : Player.values()) {
            if (copy.get(p).eliminated) continue;
            long kings = board.pieces().stream()
                    .filter(e -> e.getValue().owner == p && e.getValue().type == PieceType.KING)
                    .count();
            if (kings != 1) {
                throw new IllegalArgumentException(p + " is alive but has " + kings + " kings");
            }
        }
        GameState s = new GameState(board.copy(), copy, active, options);
        if (TurnManager.eliminateCheckmated(s)) {
            // the swept statuses become the start of the history
            if (s.statuses.get(s.active).eliminated) s.active = TurnManager.nextActive(s, s.active);
            s.startStatuses.clear();
            s.startStatuses.putAll(copyStatuses(s.statuses));
            s.startActive = s.active;
        }
        s.outcome = TurnManager.terminalOutcome(s);
        s.positionCounts.put(GameSnapshotCodec.positionKey(s), 1);
        return s;
    }

    /**
     * Independent deep copy, history included
     */
    public GameState copy() {
        GameState s = new GameState(startBoard.copy(), copyStatuses(startStatuses), startActive, options);
        s.replaceWith(this);
        return s;
    }

    private void replaceWith(GameState other) {
        for (Map.Entry<Pos, Piece> e : new ArrayList<>(board.pieces())) board.set(e.getKey(), null);
        for (Map.Entry<Pos, Piece> e : other.board.pieces()) board.set(e.getKey(), e.getValue());
        statuses.clear();
        statuses.putAll(copyStatuses(other.statuses));
        active = other.active;
        outcome = other.outcome;
        noProgress = other.noProgress;
        history.clear();
        history.addAll(other.history);
        positionCounts.clear();
        positionCounts.putAll(other.positionCounts);
    }

    static EnumMap<Player, PlayerStatus> copyStatuses(Map<Player, PlayerStatus> statuses) {
        EnumMap<Player, PlayerStatus> out = new EnumMap<>(Player.class);
        for (Map.Entry<Player, PlayerStatus> e : statuses.entrySet()) out.put(e.getKey(), e.getValue().copy());
        return out;
    }

    /* ===================== Queries ===================== */

    /** Copy of the current board; changing it does not affect the game. */
    public Board getBoard() {
        return board.copy();
    }

    public Player getActivePlayer() {
        return active;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public RuleOptions getOptions() {
        return options;
    }

    public PlayerStatus getStatus(Player player) {
        return statuses.get(player);
    }

    /** Plies since the last capture or pawn move. */
    public int getNoProgressPlies() {
        return noProgress;
    }

    public List<Move> getHistory() {
        List<Move> out = new ArrayList<>(history.size());
        for (Ply p : history) out.add(p.move);
        return out;
    }

    public List<Player> livePlayers() {
        List<Player> out = new ArrayList<>();
        for (Player p : Player.values()) {
            if (!statuses.get(p).eliminated) out.add(p);
        }
        return out;
    }

    /** Live players other than {@code player} and, in team play, its partner. */
    public List<Player> opponentsOf(Player player) {
        List<Player> out = livePlayers();
        out.remove(player);
        if (options.teams) out.remove(player.ally());
        return out;
    }

    /** Whether {@code a} and {@code b} are partners in team play. */
    public boolean areAllies(Player a, Player b) {
        return options.teams && a.ally() == b;
    }

    /** Legal moves of the active player. */
    public Set<Move> legalMoves() {
        return legalMoves(active);
    }

    public Set<Move> legalMoves(Player player) {
        return MoveGenerator.legalMoves(this, player);
    }

    /** Legal moves starting on {@code from}, for move hints. */
    public Set<Move> legalMoves(Pos from) {
        return MoveGenerator.legalMoves(this, from);
    }

    public GameStatus status() {
        Map<Player, GameStatus.PlayerView> views = new EnumMap<>(Player.class);
        for (Player p : Player.values()) {
            PlayerStatus st = statuses.get(p);
            boolean check = !st.eliminated && CheckEvaluator.inCheck(this, p);
            views.put(p, new GameStatus.PlayerView(p, check, st.eliminated, st.score));
        }
        return new GameStatus(active, views, outcome);
    }

    /* ===================== Mutations ===================== */

    /**
     * Play {@code move} for the active player. Only from, to and the promotion choice of the
     * argument matter.
     *
     * @throws GameAlreadyFinishedException if the outcome is already decided
     * @throws IllegalMoveException         if the move is not legal, naming the broken rule
     */
    public GameState applyMove(Move move) throws GameAlreadyFinishedException, IllegalMoveException {
        TurnManager.apply(this, move);
        return this;
    }

    /**
     * Take back the most recent ply, also after the game has finished
     *
     * @throws NoHistoryException if nothing has been played
     */
    public GameState undoLastMove() throws NoHistoryException {
        TurnManager.undo(this);
        return this;
    }
}
