package com.example.fourchess.web;

import com.example.fourchess.service.GameService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GameController.class)
@Import(GameService.class)
class GameControllerTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private GameService games;

    @BeforeEach
    void freshGame() {
        games.newGame();
    }

    @Test
    void newGameStartsWithRed() throws Exception {
        mvc.perform(post("/api/game/new"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("new"))
                .andExpect(jsonPath("$.turn").value("RED"))
                .andExpect(jsonPath("$.gameOver").value(false))
                .andExpect(jsonPath("$.players", hasSize(4)))
                .andExpect(jsonPath("$.plies").value(0));
    }

    @Test
    void moveHintsForOneSquare() throws Exception {
        mvc.perform(get("/api/game/moves").param("square", "h2"))
                .andExpect(jsonPath("$.result").value("ok"))
                .andExpect(jsonPath("$.moves", contains("h2h3", "h2h4")));

        mvc.perform(get("/api/game/moves").param("square", "z99"))
                .andExpect(jsonPath("$.result").value("bad_square"));
    }

    @Test
    void legalMovePassesTheTurn() throws Exception {
        mvc.perform(post("/api/game/move").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from\":\"h2\",\"to\":\"h4\"}"))
                .andExpect(jsonPath("$.result").value("ok"))
                .andExpect(jsonPath("$.move").value("h2h4"))
                .andExpect(jsonPath("$.turn").value("BLUE"))
                .andExpect(jsonPath("$.plies").value(1));
    }

    @Test
    void illegalMoveIsAFoul() throws Exception {
        mvc.perform(post("/api/game/move").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from\":\"b5\",\"to\":\"c5\"}"))
                .andExpect(jsonPath("$.result").value("foul"))
                .andExpect(jsonPath("$.violation").value("WRONG_TURN"));

        mvc.perform(post("/api/game/move").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from\":\"h2\",\"to\":\"q9\"}"))
                .andExpect(jsonPath("$.result").value("foul"))
                .andExpect(jsonPath("$.violation").value("OUT_OF_BOUNDS"));

        mvc.perform(get("/api/game/status"))
                .andExpect(jsonPath("$.turn").value("RED"))
                .andExpect(jsonPath("$.plies").value(0));
    }

    @Test
    void unknownPromotionLetterIsAnInvalidPromotion() throws Exception {
        mvc.perform(post("/api/game/move").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from\":\"h2\",\"to\":\"h3\",\"promotion\":\"X\"}"))
                .andExpect(jsonPath("$.result").value("foul"))
                .andExpect(jsonPath("$.violation").value("INVALID_PROMOTION"));

        mvc.perform(post("/api/game/move").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from\":\"h2\",\"to\":\"h3\",\"promotion\":\"Q\"}"))
                .andExpect(jsonPath("$.result").value("foul"))
                .andExpect(jsonPath("$.violation").value("INVALID_PROMOTION"));
    }

    @Test
    void undoTakesBackAndReportsEmptyHistory() throws Exception {
        mvc.perform(post("/api/game/undo"))
                .andExpect(jsonPath("$.result").value("no_history"));

        mvc.perform(post("/api/game/move").contentType(MediaType.APPLICATION_JSON)
                .content("{\"from\":\"h2\",\"to\":\"h3\"}"));
        mvc.perform(post("/api/game/undo"))
                .andExpect(jsonPath("$.result").value("ok"))
                .andExpect(jsonPath("$.turn").value("RED"))
                .andExpect(jsonPath("$.plies").value(0));
    }

    @Test
    void snapshotRoundTrip() throws Exception {
        mvc.perform(post("/api/game/move").contentType(MediaType.APPLICATION_JSON)
                .content("{\"from\":\"h2\",\"to\":\"h4\"}"));
        String snapshot = mvc.perform(get("/api/game/snapshot"))
                .andExpect(status().isOk())
                .andExpect(content().string(startsWith("4pc-snapshot 1")))
                .andReturn().getResponse().getContentAsString();

        games.newGame();
        mvc.perform(post("/api/game/snapshot").contentType(MediaType.TEXT_PLAIN).content(snapshot))
                .andExpect(jsonPath("$.result").value("loaded"))
                .andExpect(jsonPath("$.turn").value("BLUE"))
                .andExpect(jsonPath("$.plies").value(1));

        mvc.perform(post("/api/game/snapshot").contentType(MediaType.TEXT_PLAIN).content("nonsense"))
                .andExpect(jsonPath("$.result").value("bad_snapshot"));
        mvc.perform(get("/api/game/status"))
                .andExpect(jsonPath("$.plies").value(1));
    }
}
