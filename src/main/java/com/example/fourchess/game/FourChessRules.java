package com.example.fourchess.game;

import java.util.*;

/**
 * Four-player chess rules core:
 * - 14x14 coordinates: file 0..13 left to right (a..n), rank 0..13 bottom to top (1..14)
 * - the four 3x3 corners are not part of the board, leaving a cross shape
 * - Red sits at the bottom moving up, Blue on the left moving right,
 *   Yellow at the top moving down, Green on the right moving left
 * - Each piece class produces its own "pseudo-legal moves" (without considering self-check);
 *   {@link MoveGenerator} filters them against every live opponent.
 */
public class FourChessRules {

    public static final int SIZE = 14;
    public static final int CORNER = 3;

    /* ===================== Basic Types ===================== */

    public enum Player {
        RED('r', 0, 1, "RNBQKBNR"),
        BLUE('b', 1, 0, "RNBQKBNR"),
        YELLOW('y', 0, -1, "RNBKQBNR"),
        GREEN('g', -1, 0, "RNBKQBNR");

        public final char letter;
        /** Forward direction of this player's pawns. */
        public final int df, dr;
        /** Back line pieces, in increasing coordinate order along the back line. */
        public final String backLine;

        Player(char letter, int df, int dr, String backLine) {
            this.letter = letter;
            this.df = df;
            this.dr = dr;
            this.backLine = backLine;
        }

        /** Coordinate along the forward axis. */
        public int depth(Pos p) {
            return df != 0 ? p.file : p.rank;
        }

        public int backLineDepth() {
            return forwardSign() > 0 ? 0 : SIZE - 1;
        }

        public int pawnStartDepth() {
            return backLineDepth() + forwardSign();
        }

        public int promotionDepth() {
            return forwardSign() > 0 ? SIZE - 1 : 0;
        }

        /** Square at the given depth along the forward axis and lateral coordinate. */
        public Pos at(int depth, int lateral) {
            return df != 0 ? new Pos(depth, lateral) : new Pos(lateral, depth);
        }

        public Player next() {
            return values()[(ordinal() + 1) % values().length];
        }

        /** Partner across the board when playing in teams: Red with Yellow, Blue with Green. */
        public Player ally() {
            return values()[(ordinal() + 2) % values().length];
        }

        public static Player fromLetter(char c) {
            for (Player p : values()) {
                if (p.letter == c) return p;
            }
            throw new IllegalArgumentException("Unknown player letter: " + c);
        }

        private int forwardSign() {
            return df + dr;
        }
    }

    public enum PieceType {
        PAWN('P', 1), KNIGHT('N', 3), BISHOP('B', 5), ROOK('R', 5), QUEEN('Q', 9), KING('K', 0);

        public final char letter;
        /** Material value credited to the capturer. */
        public final int points;

        PieceType(char letter, int points) {
            this.letter = letter;
            this.points = points;
        }

        public static PieceType fromLetter(char c) {
            for (PieceType t : values()) {
                if (t.letter == Character.toUpperCase(c)) return t;
            }
            throw new IllegalArgumentException("Unknown piece letter: " + c);
        }
    }

    /**
     * Square coordinates
     */
    public static final class Pos {
        public final int file, rank;

        public Pos(int file, int rank) {
            this.file = file;
            this.rank = rank;
        }

        public Pos offset(int df, int dr) {
            return new Pos(file + df, rank + dr);
        }

        /** Parses algebraic notation such as {@code d2} or {@code n14}. */
        public static Pos parse(String s) {
            if (s == null || s.length() < 2 || s.length() > 3) {
                throw new IllegalArgumentException("Bad square: " + s);
            }
            int file = s.charAt(0) - 'a';
            int rank;
            try {
                rank = Integer.parseInt(s.substring(1)) - 1;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Bad square: " + s, e);
            }
            if (file < 0 || file >= SIZE || rank < 0 || rank >= SIZE) {
                throw new IllegalArgumentException("Bad square: " + s);
            }
            return new Pos(file, rank);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Pos p)) return false;
            return p.file == file && p.rank == rank;
        }

        @Override
        public int hashCode() {
            return file * 31 + rank;
        }

        @Override
        public String toString() {
            return "" + (char) ('a' + file) + (rank + 1);
        }
    }

    public enum MoveKind {
        NORMAL, EN_PASSANT, CASTLE_KINGSIDE, CASTLE_QUEENSIDE, PROMOTION
    }

    /**
     * Move. Equality only looks at from, to and the promotion choice; the snapshots are
     * filled in by the generator and are what undo relies on.
     */
    public static final class Move {
        public final Pos from, to;
        public final MoveKind kind;
        public final Piece piece;
        public final Piece captured;
        public final Pos capturedAt;
        public final PieceType promotion;
        public final Pos rookFrom, rookTo;
        public final Piece rook;

        private Move(Pos from, Pos to, MoveKind kind, Piece piece, Piece captured, Pos capturedAt,
                     PieceType promotion, Pos rookFrom, Pos rookTo, Piece rook) {
            this.from = from;
            this.to = to;
            this.kind = kind;
            this.piece = piece;
            this.captured = captured;
            this.capturedAt = capturedAt;
            this.promotion = promotion;
            this.rookFrom = rookFrom;
            this.rookTo = rookTo;
            this.rook = rook;
        }

        /** A move request as typed by a user: no snapshots yet. */
        public static Move request(Pos from, Pos to, PieceType promotion) {
            return new Move(from, to, promotion == null ? MoveKind.NORMAL : MoveKind.PROMOTION,
                    null, null, null, promotion, null, null, null);
        }

        static Move normal(Pos from, Pos to, Piece piece, Piece captured) {
            return new Move(from, to, MoveKind.NORMAL, piece, captured, captured == null ? null : to,
                    null, null, null, null);
        }

        static Move promotion(Pos from, Pos to, Piece piece, Piece captured, PieceType promotion) {
            return new Move(from, to, MoveKind.PROMOTION, piece, captured, captured == null ? null : to,
                    promotion, null, null, null);
        }

        static Move enPassant(Pos from, Pos to, Piece piece, Piece captured, Pos capturedAt) {
            return new Move(from, to, MoveKind.EN_PASSANT, piece, captured, capturedAt,
                    null, null, null, null);
        }

        static Move castle(Pos from, Pos to, Piece king, boolean kingside, Pos rookFrom, Pos rookTo, Piece rook) {
            return new Move(from, to, kingside ? MoveKind.CASTLE_KINGSIDE : MoveKind.CASTLE_QUEENSIDE,
                    king, null, null, null, rookFrom, rookTo, rook);
        }

        public boolean isCastle() {
            return kind == MoveKind.CASTLE_KINGSIDE || kind == MoveKind.CASTLE_QUEENSIDE;
        }

        /** Parses {@code d2d4} or {@code d13d14=Q}. */
        public static Move parse(String s) {
            String body = s;
            PieceType promo = null;
            int eq = s.indexOf('=');
            if (eq >= 0) {
                if (eq != s.length() - 2) throw new IllegalArgumentException("Bad move: " + s);
                promo = PieceType.fromLetter(s.charAt(eq + 1));
                body = s.substring(0, eq);
            }
            // the second square starts at the second letter
            int split = -1;
            for (int i = 1; i < body.length(); i++) {
                if (Character.isLetter(body.charAt(i))) {
                    split = i;
                    break;
                }
            }
            if (split < 0) throw new IllegalArgumentException("Bad move: " + s);
            return request(Pos.parse(body.substring(0, split)), Pos.parse(body.substring(split)), promo);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Move m)) return false;
            return from.equals(m.from) && to.equals(m.to) && promotion == m.promotion;
        }

        @Override
        public int hashCode() {
            return Objects.hash(from, to, promotion);
        }

        @Override
        public String toString() {
            return from.toString() + to + (promotion != null ? "=" + promotion.letter : "");
        }
    }

    /* ===================== Piece Base Class ===================== */

    /**
     * Immutable piece. Moving a piece replaces it with a copy carrying the new flags, so board
     * copies can share piece instances.
     */
    public static abstract class Piece {
        public final PieceType type;
        public final Player owner;
        public final boolean hasMoved;
        /** Set only on a pawn right after its double step; cleared at the next ply boundary. */
        public final boolean enPassant;

        protected Piece(PieceType type, Player owner, boolean hasMoved, boolean enPassant) {
            this.type = type;
            this.owner = owner;
            this.hasMoved = hasMoved;
            this.enPassant = enPassant;
        }

        public static Piece of(PieceType type, Player owner) {
            return of(type, owner, false, false);
        }

        public static Piece of(PieceType type, Player owner, boolean hasMoved, boolean enPassant) {
            return switch (type) {
                case PAWN -> new Pawn(owner, hasMoved, enPassant);
                case KNIGHT -> new Knight(owner, hasMoved);
                case BISHOP -> new Bishop(owner, hasMoved);
                case ROOK -> new Rook(owner, hasMoved);
                case QUEEN -> new Queen(owner, hasMoved);
                case KING -> new King(owner, hasMoved);
            };
        }

        public Piece moved() {
            return of(type, owner, true, false);
        }

        public Piece withEnPassant(boolean flag) {
            return flag == enPassant ? this : of(type, owner, hasMoved, flag);
        }

        /**
         * Generate only "rule-based" moves (without considering self-check). Captures of a king are
         * never produced.
         */
        public abstract void pseudoLegalMoves(Board b, Pos from, List<Move> out);

        /** Squares this piece threatens, whether empty or occupied by anyone. */
        public abstract void attackedSquares(Board b, Pos from, Set<Pos> out);

        /** Whether this piece standing on {@code from} threatens {@code target}. */
        public abstract boolean attacks(Board b, Pos from, Pos target);

        protected static final int[][] ORTHO = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
        protected static final int[][] DIAG = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};
        protected static final int[][] ALL = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}, {1, 1}, {1, -1}, {-1, 1}, {-1, -1}};
        protected static final int[][] JUMPS = {{1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}};

        protected boolean isOwn(Piece q) {
            return q != null && q.owner == owner;
        }

        /** Step moves from a fixed offset table (knight, king). */
        protected void stepMoves(Board b, Pos from, int[][] offsets, List<Move> out) {
            for (int[] d : offsets) {
                Pos to = from.offset(d[0], d[1]);
                if (!Board.onBoard(to)) continue;
                Piece q = b.at(to);
                if (isOwn(q) || (q != null && q.type == PieceType.KING)) continue;
                out.add(Move.normal(from, to, this, q));
            }
        }

        protected void stepTargets(Pos from, int[][] offsets, Set<Pos> out) {
            for (int[] d : offsets) {
                Pos to = from.offset(d[0], d[1]);
                if (Board.onBoard(to)) out.add(to);
            }
        }

        protected static boolean withinOffsets(Pos from, Pos target, int[][] offsets) {
            int df = target.file - from.file, dr = target.rank - from.rank;
            for (int[] d : offsets) {
                if (d[0] == df && d[1] == dr) return true;
            }
            return false;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Piece p)) return false;
            return p.type == type && p.owner == owner && p.hasMoved == hasMoved && p.enPassant == enPassant;
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, owner, hasMoved, enPassant);
        }

        @Override
        public String toString() {
            return "" + owner.letter + type.letter + (enPassant ? "!" : hasMoved ? "+" : "");
        }
    }

    /**
     * Sliding pieces: walk each ray until the board edge, an own piece (excluded) or an enemy
     * piece (included as capture, unless it is a king).
     */
    public static abstract class SlidingPiece extends Piece {
        private final int[][] rays;

        protected SlidingPiece(PieceType type, Player owner, boolean hasMoved, int[][] rays) {
            super(type, owner, hasMoved, false);
            this.rays = rays;
        }

        @Override
        public void pseudoLegalMoves(Board b, Pos from, List<Move> out) {
            for (int[] d : rays) {
                Pos to = from.offset(d[0], d[1]);
                while (Board.onBoard(to)) {
                    Piece q = b.at(to);
                    if (q == null) {
                        out.add(Move.normal(from, to, this, null));
                    } else {
                        if (!isOwn(q) && q.type != PieceType.KING) out.add(Move.normal(from, to, this, q));
                        break;
                    }
                    to = to.offset(d[0], d[1]);
                }
            }
        }

        @Override
        public void attackedSquares(Board b, Pos from, Set<Pos> out) {
            for (int[] d : rays) {
                Pos to = from.offset(d[0], d[1]);
                while (Board.onBoard(to)) {
                    out.add(to);
                    if (b.at(to) != null) break;
                    to = to.offset(d[0], d[1]);
                }
            }
        }

        @Override
        public boolean attacks(Board b, Pos from, Pos target) {
            int df = Integer.signum(target.file - from.file), dr = Integer.signum(target.rank - from.rank);
            if (from.equals(target) || !Board.aligned(from, target)) return false;
            for (int[] d : rays) {
                if (d[0] == df && d[1] == dr) {
                    for (Pos p : b.squaresBetween(from, target)) {
                        if (b.at(p) != null) return false;
                    }
                    return true;
                }
            }
            return false;
        }
    }

    /* ===================== Piece Rules ===================== */

    public static final class Rook extends SlidingPiece {
        public Rook(Player owner, boolean hasMoved) {
            super(PieceType.ROOK, owner, hasMoved, ORTHO);
        }
    }

    public static final class Bishop extends SlidingPiece {
        public Bishop(Player owner, boolean hasMoved) {
            super(PieceType.BISHOP, owner, hasMoved, DIAG);
        }
    }

    public static final class Queen extends SlidingPiece {
        public Queen(Player owner, boolean hasMoved) {
            super(PieceType.QUEEN, owner, hasMoved, ALL);
        }
    }

    public static final class Knight extends Piece {
        public Knight(Player owner, boolean hasMoved) {
            super(PieceType.KNIGHT, owner, hasMoved, false);
        }

        @Override
        public void pseudoLegalMoves(Board b, Pos from, List<Move> out) {
            stepMoves(b, from, JUMPS, out);
        }

        @Override
        public void attackedSquares(Board b, Pos from, Set<Pos> out) {
            stepTargets(from, JUMPS, out);
        }

        @Override
        public boolean attacks(Board b, Pos from, Pos target) {
            return withinOffsets(from, target, JUMPS);
        }
    }

    /**
     * King: one square in any direction. Castling is co-generated with an unmoved rook of the same
     * player standing on the king's back line with nothing in between; the king goes two squares
     * towards it and the rook lands on the square the king crossed. Whether the king passes through
     * an attacked square is checked by {@link MoveGenerator}.
     */
    public static final class King extends Piece {
        public King(Player owner, boolean hasMoved) {
            super(PieceType.KING, owner, hasMoved, false);
        }

        @Override
        public void pseudoLegalMoves(Board b, Pos from, List<Move> out) {
            stepMoves(b, from, ALL, out);
            if (hasMoved) return;
            // lateral directions run along the back line
            int[][] lateral = owner.df != 0 ? new int[][]{{0, 1}, {0, -1}} : new int[][]{{1, 0}, {-1, 0}};
            for (int[] d : lateral) {
                Pos p = from.offset(d[0], d[1]);
                int dist = 1;
                while (Board.onBoard(p) && b.at(p) == null) {
                    p = p.offset(d[0], d[1]);
                    dist++;
                }
                if (!Board.onBoard(p) || dist < 3) continue;
                Piece q = b.at(p);
                if (q.type != PieceType.ROOK || q.owner != owner || q.hasMoved) continue;
                Pos kingTo = from.offset(2 * d[0], 2 * d[1]);
                Pos rookTo = from.offset(d[0], d[1]);
                out.add(Move.castle(from, kingTo, this, dist == 3, p, rookTo, q));
            }
        }

        @Override
        public void attackedSquares(Board b, Pos from, Set<Pos> out) {
            stepTargets(from, ALL, out);
        }

        @Override
        public boolean attacks(Board b, Pos from, Pos target) {
            return withinOffsets(from, target, ALL);
        }
    }

    /**
     * Pawn: advances along its owner's forward direction; double step from the start line when both
     * squares are empty; captures on the two forward diagonals; en passant against an adjacent enemy
     * pawn that has just double-stepped over the target square; promotes on the owner's far edge.
     */
    public static final class Pawn extends Piece {
        private static final PieceType[] PROMOTIONS = {PieceType.QUEEN, PieceType.ROOK, PieceType.BISHOP, PieceType.KNIGHT};

        public Pawn(Player owner, boolean hasMoved, boolean enPassant) {
            super(PieceType.PAWN, owner, hasMoved, enPassant);
        }

        @Override
        public void pseudoLegalMoves(Board b, Pos from, List<Move> out) {
            int df = owner.df, dr = owner.dr;
            Pos one = from.offset(df, dr);
            if (Board.onBoard(one) && b.at(one) == null) {
                addAdvance(from, one, null, out);
                Pos two = one.offset(df, dr);
                if (owner.depth(from) == owner.pawnStartDepth() && Board.onBoard(two) && b.at(two) == null) {
                    out.add(Move.normal(from, two, this, null));
                }
            }
            for (Pos to : diagonals(from)) {
                if (!Board.onBoard(to)) continue;
                Piece q = b.at(to);
                if (q != null) {
                    if (!isOwn(q) && q.type != PieceType.KING) addAdvance(from, to, q, out);
                    continue;
                }
                // the passed pawn stands one step beyond the skipped square, seen from its owner
                for (Player enemy : Player.values()) {
                    if (enemy == owner) continue;
                    Pos passed = to.offset(enemy.df, enemy.dr);
                    Piece v = b.at(passed);
                    if (v != null && v.owner == enemy && v.type == PieceType.PAWN && v.enPassant
                            && Board.adjacent(from, passed)) {
                        out.add(Move.enPassant(from, to, this, v, passed));
                    }
                }
            }
        }

        private void addAdvance(Pos from, Pos to, Piece captured, List<Move> out) {
            if (owner.depth(to) == owner.promotionDepth()) {
                for (PieceType t : PROMOTIONS) out.add(Move.promotion(from, to, this, captured, t));
            } else {
                out.add(Move.normal(from, to, this, captured));
            }
        }

        /** The two forward-diagonal squares. */
        public Pos[] diagonals(Pos from) {
            int df = owner.df, dr = owner.dr;
            // perpendicular to forward: swap the components
            return new Pos[]{from.offset(df + dr, dr + df), from.offset(df - dr, dr - df)};
        }

        @Override
        public void attackedSquares(Board b, Pos from, Set<Pos> out) {
            for (Pos p : diagonals(from)) {
                if (Board.onBoard(p)) out.add(p);
            }
        }

        @Override
        public boolean attacks(Board b, Pos from, Pos target) {
            for (Pos p : diagonals(from)) {
                if (p.equals(target)) return true;
            }
            return false;
        }
    }

    /* ===================== Board ===================== */

    /**
     * Sparse board: only occupied, on-board squares are keys.
     */
    public static final class Board {
        private final Map<Pos, Piece> squares;

        public Board() {
            this.squares = new HashMap<>();
        }

        private Board(Map<Pos, Piece> squares) {
            this.squares = new HashMap<>(squares);
        }

        public static boolean onBoard(Pos p) {
            return onBoard(p.file, p.rank);
        }

        public static boolean onBoard(int file, int rank) {
            if (file < 0 || file >= SIZE || rank < 0 || rank >= SIZE) return false;
            boolean edgeFile = file < CORNER || file >= SIZE - CORNER;
            boolean edgeRank = rank < CORNER || rank >= SIZE - CORNER;
            return !(edgeFile && edgeRank);
        }

        static boolean aligned(Pos a, Pos b) {
            int df = b.file - a.file, dr = b.rank - a.rank;
            return df == 0 || dr == 0 || Math.abs(df) == Math.abs(dr);
        }

        static boolean adjacent(Pos a, Pos b) {
            return Math.max(Math.abs(a.file - b.file), Math.abs(a.rank - b.rank)) == 1;
        }

        public Piece at(Pos p) {
            return squares.get(p);
        }

        public void set(Pos p, Piece piece) {
            if (!onBoard(p)) throw new InvalidPositionException(p);
            if (piece == null) squares.remove(p);
            else squares.put(p, piece);
        }

        /**
         * Squares strictly between a and b along a rank, file or diagonal, ordered from a towards b.
         * Empty when the two squares are not aligned.
         */
        public List<Pos> squaresBetween(Pos a, Pos b) {
            if (a.equals(b) || !aligned(a, b)) return Collections.emptyList();
            int df = Integer.signum(b.file - a.file), dr = Integer.signum(b.rank - a.rank);
            List<Pos> out = new ArrayList<>();
            Pos p = a.offset(df, dr);
            while (!p.equals(b)) {
                out.add(p);
                p = p.offset(df, dr);
            }
            return out;
        }

        /** Occupied squares, unordered. */
        public Set<Map.Entry<Pos, Piece>> pieces() {
            return Collections.unmodifiableMap(squares).entrySet();
        }

        public Map<Pos, Piece> piecesOf(Player player) {
            Map<Pos, Piece> out = new HashMap<>();
            for (Map.Entry<Pos, Piece> e : squares.entrySet()) {
                if (e.getValue().owner == player) out.put(e.getKey(), e.getValue());
            }
            return out;
        }

        public Pos findKing(Player player) {
            for (Map.Entry<Pos, Piece> e : squares.entrySet()) {
                Piece p = e.getValue();
                if (p.type == PieceType.KING && p.owner == player) return e.getKey();
            }
            return null;
        }

        public int size() {
            return squares.size();
        }

        /**
         * Create the standard starting layout
         */
        public static Board initial() {
            Board b = new Board();
            for (Player pl : Player.values()) {
                for (int i = 0; i < pl.backLine.length(); i++) {
                    int lateral = CORNER + i;
                    PieceType t = PieceType.fromLetter(pl.backLine.charAt(i));
                    b.set(pl.at(pl.backLineDepth(), lateral), Piece.of(t, pl));
                    b.set(pl.at(pl.pawnStartDepth(), lateral), Piece.of(PieceType.PAWN, pl));
                }
            }
            return b;
        }

        /**
         * Play a generated move on this board (without validation)
         */
        public void apply(Move m) {
            squares.remove(m.from);
            if (m.capturedAt != null) squares.remove(m.capturedAt);
            Piece placed;
            if (m.kind == MoveKind.PROMOTION) {
                placed = Piece.of(m.promotion, m.piece.owner, true, false);
            } else if (m.piece.type == PieceType.PAWN && Math.abs(m.piece.owner.depth(m.to) - m.piece.owner.depth(m.from)) == 2) {
                placed = m.piece.moved().withEnPassant(true);
            } else {
                placed = m.piece.moved();
            }
            squares.put(m.to, placed);
            if (m.isCastle()) {
                squares.remove(m.rookFrom);
                squares.put(m.rookTo, m.rook.moved());
            }
        }

        /**
         * Exact inverse of {@link #apply(Move)}
         */
        public void undo(Move m) {
            if (m.isCastle()) {
                squares.remove(m.rookTo);
                squares.put(m.rookFrom, m.rook);
            }
            squares.remove(m.to);
            squares.put(m.from, m.piece);
            if (m.captured != null) squares.put(m.capturedAt, m.captured);
        }

        /**
         * Simulate move on a scratch copy
         */
        public Board makeMove(Move m) {
            Board nb = copy();
            nb.apply(m);
            return nb;
        }

        public Board copy() {
            return new Board(squares);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Board b && b.squares.equals(squares);
        }

        @Override
        public int hashCode() {
            return squares.hashCode();
        }
    }
}
