package com.example.fourchess.game;

import com.example.fourchess.game.FourChessRules.*;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Text snapshot of a game. A snapshot holds the start position, the moves played since and the
 * resulting position:
 *
 * <pre>
 * 4pc-snapshot 1
 * rules 0 0 ffa
 * start 3yR+yN ... /... r - r=0,b=0,y=0,g=0
 * moves h2h4 b8d8
 * current ... y - r=0,b=0,y=0,g=0 IN_PROGRESS
 * </pre>
 *
 * Boards are written top rank first, ranks separated by {@code /}, runs of empty squares as
 * numbers and pieces as owner letter, type letter and an optional flag ({@code +} moved,
 * {@code !} may be taken en passant). Reading replays the moves, so the loaded game can be undone
 * back to its start.
 */
public final class GameSnapshotCodec {

    public static final String HEADER = "4pc-snapshot 1";

    private GameSnapshotCodec() {
    }

    public static String encode(GameState s) {
        StringBuilder sb = new StringBuilder();
        sb.append(HEADER).append('\n');
        sb.append("rules ").append(s.options.repetitionLimit).append(' ').append(s.options.noProgressPlies)
                .append(' ').append(s.options.teams ? "teams" : "ffa").append('\n');
        sb.append("start ").append(encodePosition(s.startBoard, s.startActive, s.startStatuses)).append('\n');
        sb.append("moves");
        for (Move m : s.getHistory()) sb.append(' ').append(m);
        sb.append('\n');
        sb.append("current ").append(encodePosition(s.board, s.active, s.statuses))
                .append(' ').append(s.outcome).append('\n');
        return sb.toString();
    }

    public static GameState decode(String text) throws SnapshotFormatException {
        if (text == null) throw new SnapshotFormatException("Empty snapshot");
        String[] lines = text.strip().split("\\R");
        if (lines.length != 5 || !lines[0].strip().equals(HEADER)) {
            throw new SnapshotFormatException("Expected '" + HEADER + "' followed by rules, start, moves and current lines");
        }
        RuleOptions options = parseRules(field(lines[1], "rules"));

        String[] start = field(lines[2], "start").split(" ");
        if (start.length != 4) throw new SnapshotFormatException("Bad start line: " + lines[2]);
        Board board = decodeBoard(start[0]);
        Player active = parsePlayer(start[1]);
        Map<Player, PlayerStatus> statuses = parseStatuses(start[2], start[3]);

        GameState s;
        try {
            s = GameState.resume(board, statuses, active, options);
        } catch (IllegalArgumentException e) {
            throw new SnapshotFormatException("Bad start position: " + e.getMessage(), e);
        }

        String moves = field(lines[3], "moves");
        if (!moves.isEmpty()) {
            for (String token : moves.split(" +")) {
                try {
                    s.applyMove(Move.parse(token));
                } catch (IllegalArgumentException | IllegalMoveException | GameAlreadyFinishedException e) {
                    throw new SnapshotFormatException("Cannot replay move " + token + ": " + e.getMessage(), e);
                }
            }
        }

        String current = field(lines[4], "current");
        String expected = encodePosition(s.board, s.active, s.statuses) + " " + s.outcome;
        if (!current.equals(expected)) {
            throw new SnapshotFormatException("Replayed position does not match: expected '" + current
                    + "' but got '" + expected + "'");
        }
        return s;
    }

    /**
     * Key for repetition counting: board with flags, side to move and eliminations.
     */
    static String positionKey(GameState s) {
        return encodeBoard(s.board) + ' ' + s.active.letter + ' ' + eliminated(s.statuses);
    }

    static String encodePosition(Board board, Player active, Map<Player, PlayerStatus> statuses) {
        StringBuilder scores = new StringBuilder();
        for (Player p : Player.values()) {
            if (scores.length() > 0) scores.append(',');
            scores.append(p.letter).append('=').append(statuses.get(p).score);
        }
        return encodeBoard(board) + ' ' + active.letter + ' ' + eliminated(statuses) + ' ' + scores;
    }

    private static String eliminated(Map<Player, PlayerStatus> statuses) {
        StringBuilder sb = new StringBuilder();
        for (Player p : Player.values()) {
            if (statuses.get(p).eliminated) sb.append(p.letter);
        }
        return sb.length() == 0 ? "-" : sb.toString();
    }

    public static String encodeBoard(Board board) {
        StringBuilder sb = new StringBuilder();
        for (int rank = FourChessRules.SIZE - 1; rank >= 0; rank--) {
            int empty = 0;
            for (int file = 0; file < FourChessRules.SIZE; file++) {
                Piece piece = Board.onBoard(file, rank) ? board.at(new Pos(file, rank)) : null;
                if (piece == null) {
                    empty++;
                    continue;
                }
                if (empty > 0) {
                    sb.append(empty);
                    empty = 0;
                }
                sb.append(piece);
            }
            if (empty > 0) sb.append(empty);
            if (rank > 0) sb.append('/');
        }
        return sb.toString();
    }

    public static Board decodeBoard(String text) throws SnapshotFormatException {
        String[] ranks = text.split("/", -1);
        if (ranks.length != FourChessRules.SIZE) {
            throw new SnapshotFormatException("Board needs " + FourChessRules.SIZE + " ranks, got " + ranks.length);
        }
        Board board = new Board();
        for (int i = 0; i < ranks.length; i++) {
            int rank = FourChessRules.SIZE - 1 - i;
            String row = ranks[i];
            int file = 0;
            int k = 0;
            while (k < row.length()) {
                char c = row.charAt(k);
                if (Character.isDigit(c)) {
                    int n = 0;
                    while (k < row.length() && Character.isDigit(row.charAt(k))) {
                        n = n * 10 + (row.charAt(k) - '0');
                        k++;
                    }
                    file += n;
                    continue;
                }
                if (k + 1 >= row.length()) throw new SnapshotFormatException("Truncated piece in rank " + (rank + 1));
                Piece piece;
                try {
                    Player owner = Player.fromLetter(c);
                    PieceType type = PieceType.fromLetter(row.charAt(k + 1));
                    k += 2;
                    boolean moved = false, enPassant = false;
                    if (k < row.length() && row.charAt(k) == '+') {
                        moved = true;
                        k++;
                    } else if (k < row.length() && row.charAt(k) == '!') {
                        moved = true;
                        enPassant = true;
                        k++;
                    }
                    if (enPassant && type != PieceType.PAWN) {
                        throw new SnapshotFormatException("Only pawns can carry the en passant flag");
                    }
                    piece = Piece.of(type, owner, moved, enPassant);
                } catch (IllegalArgumentException e) {
                    throw new SnapshotFormatException("Bad piece in rank " + (rank + 1) + ": " + e.getMessage(), e);
                }
                if (file >= FourChessRules.SIZE || !Board.onBoard(file, rank)) {
                    throw new SnapshotFormatException("Piece off the board at file " + file + ", rank " + (rank + 1));
                }
                board.set(new Pos(file, rank), piece);
                file++;
            }
            if (file != FourChessRules.SIZE) {
                throw new SnapshotFormatException("Rank " + (rank + 1) + " covers " + file + " files");
            }
        }
        return board;
    }

    private static String field(String line, String name) throws SnapshotFormatException {
        String l = line.strip();
        if (l.equals(name)) return "";
        if (!l.startsWith(name + " ")) throw new SnapshotFormatException("Expected '" + name + "' line, got: " + line);
        return l.substring(name.length() + 1).strip();
    }

    private static RuleOptions parseRules(String text) throws SnapshotFormatException {
        String[] parts = text.split(" ");
        try {
            if (parts.length != 3) throw new IllegalArgumentException("two numbers and ffa or teams expected");
            if (!parts[2].equals("ffa") && !parts[2].equals("teams")) {
                throw new IllegalArgumentException("unknown play mode " + parts[2]);
            }
            return new RuleOptions(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), parts[2].equals("teams"));
        } catch (IllegalArgumentException e) {
            throw new SnapshotFormatException("Bad rules line: " + e.getMessage(), e);
        }
    }

    private static Player parsePlayer(String text) throws SnapshotFormatException {
        if (text.length() != 1) throw new SnapshotFormatException("Bad player: " + text);
        try {
            return Player.fromLetter(text.charAt(0));
        } catch (IllegalArgumentException e) {
            throw new SnapshotFormatException(e.getMessage(), e);
        }
    }

    private static Map<Player, PlayerStatus> parseStatuses(String eliminated, String scores) throws SnapshotFormatException {
        Map<Player, PlayerStatus> out = new EnumMap<>(Player.class);
        for (Player p : Player.values()) out.put(p, new PlayerStatus());
        if (!eliminated.equals("-")) {
            for (char c : eliminated.toCharArray()) out.get(parsePlayer(String.valueOf(c))).eliminated = true;
        }
        List<String> entries = List.of(scores.split(","));
        if (entries.size() != Player.values().length) throw new SnapshotFormatException("Bad scores: " + scores);
        for (String entry : entries) {
            if (entry.length() < 3 || entry.charAt(1) != '=') throw new SnapshotFormatException("Bad score: " + entry);
            try {
                out.get(parsePlayer(entry.substring(0, 1))).score = Integer.parseInt(entry.substring(2));
            } catch (NumberFormatException e) {
                throw new SnapshotFormatException("Bad score: " + entry, e);
            }
        }
        return out;
    }
}
