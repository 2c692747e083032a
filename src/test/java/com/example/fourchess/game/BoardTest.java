package com.example.fourchess.game;

import com.example.fourchess.game.FourChessRules.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.fourchess.game.TestBoards.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoardTest {

    @Test
    void cornersAreNotOnTheBoard() {
        assertThat(Board.onBoard(0, 0)).isFalse();
        assertThat(Board.onBoard(2, 2)).isFalse();
        assertThat(Board.onBoard(11, 11)).isFalse();
        assertThat(Board.onBoard(13, 0)).isFalse();
        assertThat(Board.onBoard(0, 13)).isFalse();
        assertThat(Board.onBoard(3, 0)).isTrue();
        assertThat(Board.onBoard(0, 3)).isTrue();
        assertThat(Board.onBoard(10, 10)).isTrue();
        assertThat(Board.onBoard(13, 10)).isTrue();
        assertThat(Board.onBoard(-1, 5)).isFalse();
        assertThat(Board.onBoard(14, 5)).isFalse();
    }

    @Test
    void crossHas160Squares() {
        int count = 0;
        for (int f = 0; f < FourChessRules.SIZE; f++) {
            for (int r = 0; r < FourChessRules.SIZE; r++) {
                if (Board.onBoard(f, r)) count++;
            }
        }
        assertThat(count).isEqualTo(14 * 14 - 4 * 9);
    }

    @Test
    void writingOffTheBoardFails() {
        Board b = new Board();
        assertThatThrownBy(() -> b.set(new Pos(1, 1), Piece.of(PieceType.PAWN, Player.RED)))
                .isInstanceOf(InvalidPositionException.class)
                .hasMessageContaining("b2");
        assertThat(b.size()).isZero();
    }

    @Test
    void setNullClearsSquare() {
        Board b = board("e4=rQ");
        b.set(sq("e4"), null);
        assertThat(b.at(sq("e4"))).isNull();
        assertThat(b.size()).isZero();
    }

    @Test
    void squaresBetweenFollowsRaysInOrder() {
        Board b = new Board();
        assertThat(b.squaresBetween(sq("d1"), sq("d5"))).containsExactly(sq("d2"), sq("d3"), sq("d4"));
        assertThat(b.squaresBetween(sq("k4"), sq("g4"))).containsExactly(sq("j4"), sq("i4"), sq("h4"));
        assertThat(b.squaresBetween(sq("e4"), sq("h7"))).containsExactly(sq("f5"), sq("g6"));
        assertThat(b.squaresBetween(sq("e4"), sq("f6"))).isEmpty();
        assertThat(b.squaresBetween(sq("e4"), sq("e5"))).isEmpty();
        assertThat(b.squaresBetween(sq("e4"), sq("e4"))).isEmpty();
    }

    @Test
    void initialLayoutHasSixteenPiecesPerPlayer() {
        Board b = Board.initial();
        assertThat(b.size()).isEqualTo(64);
        for (Player p : Player.values()) {
            Map<Pos, Piece> own = b.piecesOf(p);
            assertThat(own).hasSize(16);
            assertThat(own.values().stream().filter(x -> x.type == PieceType.PAWN)).hasSize(8);
            assertThat(own.values().stream().filter(x -> x.type == PieceType.KING)).hasSize(1);
        }
        assertThat(b.findKing(Player.RED)).isEqualTo(sq("h1"));
        assertThat(b.findKing(Player.BLUE)).isEqualTo(sq("a8"));
        assertThat(b.findKing(Player.YELLOW)).isEqualTo(sq("g14"));
        assertThat(b.findKing(Player.GREEN)).isEqualTo(sq("n7"));
        assertThat(b.at(sq("g1")).type).isEqualTo(PieceType.QUEEN);
        assertThat(b.at(sq("h14")).type).isEqualTo(PieceType.QUEEN);
        assertThat(b.at(sq("b4")).owner).isEqualTo(Player.BLUE);
        assertThat(b.at(sq("m11")).owner).isEqualTo(Player.GREEN);
    }

    @Test
    void applyThenUndoRestoresBoard() {
        Board b = Board.initial();
        Board before = b.copy();
        List<Move> moves = MoveGenerator.pseudoLegalMoves(b, Player.RED);
        for (Move m : moves) {
            b.apply(m);
            assertThat(b).isNotEqualTo(before);
            b.undo(m);
            assertThat(b).isEqualTo(before);
        }
    }

    @Test
    void doubleStepSetsEnPassantFlag() {
        Board b = Board.initial();
        Move m = MoveGenerator.pseudoLegalMoves(b, Player.RED).stream()
                .filter(x -> x.to.equals(sq("e4"))).findFirst().orElseThrow();
        Board after = b.makeMove(m);
        assertThat(after.at(sq("e4")).enPassant).isTrue();
        assertThat(after.at(sq("e4")).hasMoved).isTrue();
        assertThat(b.at(sq("e2"))).isNotNull();
    }

    @Test
    void squareNotation() {
        assertThat(new Pos(0, 7).toString()).isEqualTo("a8");
        assertThat(new Pos(13, 13).toString()).isEqualTo("n14");
        assertThat(Pos.parse("n14")).isEqualTo(new Pos(13, 13));
        assertThatThrownBy(() -> Pos.parse("o3")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Pos.parse("a15")).isInstanceOf(IllegalArgumentException.class);
    }
}
