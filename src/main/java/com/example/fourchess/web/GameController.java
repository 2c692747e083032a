// GameController.java
package com.example.fourchess.web;

import com.example.fourchess.game.*;
import com.example.fourchess.game.FourChessRules.*;
import com.example.fourchess.service.GameService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/api/game")
@CrossOrigin(origins = "*")
public class GameController {

    private static final Logger log = LoggerFactory.getLogger(GameController.class);

    private final GameService games;

    public GameController(GameService games) {
        this.games = games;
    }

    /** New game */
    @PostMapping("/new")
    public Map<String, Object> newGame() {
        GameStatus status = games.newGame();
        Map<String, Object> resp = describe(status);
        resp.put("result", "new");
        return resp;
    }

    /** Move hints for one square */
    @GetMapping("/moves")
    public Map<String, Object> moves(@RequestParam String square) {
        Map<String, Object> resp = new HashMap<>();
        Pos from;
        try {
            from = Pos.parse(square);
        } catch (IllegalArgumentException e) {
            resp.put("result", "bad_square");
            resp.put("message", e.getMessage());
            return resp;
        }
        List<String> moves = new ArrayList<>();
        for (Move m : games.legalMoves(from)) moves.add(m.toString());
        Collections.sort(moves);
        resp.put("result", "ok");
        resp.put("square", from.toString());
        resp.put("moves", moves);
        return resp;
    }

    /** Player move: {"from":"h2","to":"h4","promotion":"Q"} */
    @PostMapping("/move")
    public Map<String, Object> playerMove(@RequestBody Map<String, String> move) {
        Map<String, Object> resp = new HashMap<>();
        Pos from, to;
        try {
            from = Pos.parse(move.get("from"));
            to = Pos.parse(move.get("to"));
        } catch (IllegalArgumentException e) {
            return foul(resp, IllegalMoveException.Violation.OUT_OF_BOUNDS, e.getMessage());
        }
        String letter = move.get("promotion");
        PieceType promotion = null;
        if (letter != null && !letter.isEmpty()) {
            try {
                if (letter.length() != 1) throw new IllegalArgumentException("Unknown piece letter: " + letter);
                promotion = PieceType.fromLetter(letter.charAt(0));
            } catch (IllegalArgumentException e) {
                return foul(resp, IllegalMoveException.Violation.INVALID_PROMOTION, e.getMessage());
            }
        }
        Move m = Move.request(from, to, promotion);

        try {
            GameStatus status = games.applyMove(m);
            resp.putAll(describe(status));
            resp.put("result", status.outcome.isFinished() ? "game_over" : "ok");
            resp.put("move", m.toString());
        } catch (IllegalMoveException e) {
            log.warn("Rejected {}: {}", m, e.getViolation());
            foul(resp, e.getViolation(), e.getViolation().getDescription());
        } catch (GameAlreadyFinishedException e) {
            resp.put("result", "game_over");
            resp.put("gameResult", e.getOutcome().getDescription());
        }
        return resp;
    }

    /** Take back the last ply */
    @PostMapping("/undo")
    public Map<String, Object> undo() {
        Map<String, Object> resp = new HashMap<>();
        try {
            resp.putAll(describe(games.undo()));
            resp.put("result", "ok");
        } catch (NoHistoryException e) {
            resp.put("result", "no_history");
            resp.put("message", e.getMessage());
        }
        return resp;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> resp = describe(games.status());
        resp.put("result", "ok");
        return resp;
    }

    @GetMapping(value = "/snapshot", produces = MediaType.TEXT_PLAIN_VALUE)
    public String snapshot() {
        return games.snapshot();
    }

    @PostMapping(value = "/snapshot", consumes = MediaType.TEXT_PLAIN_VALUE)
    public Map<String, Object> load(@RequestBody String snapshot) {
        Map<String, Object> resp = new HashMap<>();
        try {
            resp.putAll(describe(games.load(snapshot)));
            resp.put("result", "loaded");
        } catch (SnapshotFormatException e) {
            log.warn("Rejected snapshot: {}", e.getMessage());
            resp.put("result", "bad_snapshot");
            resp.put("message", e.getMessage());
        }
        return resp;
    }

    /* ---------- Response helpers ---------- */

    private Map<String, Object> foul(Map<String, Object> resp, IllegalMoveException.Violation violation, String message) {
        resp.put("result", "foul");
        resp.put("violation", violation.name());
        resp.put("message", message);
        return resp;
    }

    private Map<String, Object> describe(GameStatus status) {
        Map<String, Object> resp = new HashMap<>();
        resp.put("turn", status.activePlayer.toString());
        resp.put("gameOver", status.outcome.isFinished());
        resp.put("gameResult", status.outcome.getDescription());
        if (status.outcome.getWinner() != null) resp.put("winner", status.outcome.getWinner().toString());

        List<Map<String, Object>> players = new ArrayList<>();
        for (GameStatus.PlayerView v : status.players.values()) {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("player", v.player.toString());
            p.put("inCheck", v.inCheck);
            p.put("eliminated", v.eliminated);
            p.put("score", v.score);
            players.add(p);
        }
        resp.put("players", players);
        resp.put("board", games.board());
        resp.put("plies", games.historySize());
        return resp;
    }
}
