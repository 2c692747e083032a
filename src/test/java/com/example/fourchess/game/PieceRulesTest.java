package com.example.fourchess.game;

import com.example.fourchess.game.FourChessRules.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.example.fourchess.game.TestBoards.*;
import static org.assertj.core.api.Assertions.assertThat;

class PieceRulesTest {

    private static List<Move> pseudo(Board b, String square) {
        List<Move> out = new ArrayList<>();
        b.at(sq(square)).pseudoLegalMoves(b, sq(square), out);
        return out;
    }

    private static List<String> targets(Board b, String square) {
        return pseudo(b, square).stream().map(m -> m.to.toString()).sorted().collect(Collectors.toList());
    }

    @ParameterizedTest(name = "{0} pawn on {1} advances to {2} and {3}")
    @CsvSource({
            "RED, e2, e3, e4",
            "BLUE, b5, c5, d5",
            "YELLOW, e13, e12, e11",
            "GREEN, m5, l5, k5"
    })
    void pawnsAdvanceAlongTheirOwnersForwardDirection(Player owner, String from, String one, String two) {
        Board b = Board.initial();
        assertThat(b.at(sq(from)).owner).isEqualTo(owner);
        assertThat(targets(b, from)).containsExactlyInAnyOrder(one, two);
    }

    @Test
    void doubleStepNeedsBothSquaresEmpty() {
        Board b = board("e2=rP", "e4=bN");
        assertThat(targets(b, "e2")).containsExactly("e3");
        b = board("e2=rP", "e3=yN");
        assertThat(targets(b, "e2")).isEmpty();
    }

    @Test
    void doubleStepOnlyFromStartLine() {
        Board b = board("e3=rP+");
        assertThat(targets(b, "e3")).containsExactly("e4");
    }

    @Test
    void pawnCapturesOnForwardDiagonalsOnly() {
        Board b = board("f6=rP+", "e7=bN", "g7=yB", "f7=gR", "e5=bQ");
        assertThat(targets(b, "f6")).containsExactlyInAnyOrder("e7", "g7");

        // blue pawns look right
        b = board("f6=bP+", "g7=rN", "g5=yN", "e7=rQ");
        assertThat(targets(b, "f6")).containsExactlyInAnyOrder("g6", "g7", "g5");
    }

    @Test
    void pawnNeverCapturesOwnPieceOrKing() {
        Board b = board("f6=rP+", "e7=rN", "g7=yK");
        assertThat(targets(b, "f6")).containsExactly("f7");
    }

    @Test
    void redPawnPromotesOnFarEdge() {
        Board b = board("f13=rP+");
        List<Move> moves = pseudo(b, "f13");
        assertThat(moves).hasSize(4);
        assertThat(moves).allMatch(m -> m.kind == MoveKind.PROMOTION && m.to.equals(sq("f14")));
        assertThat(moves.stream().map(m -> m.promotion))
                .containsExactlyInAnyOrder(PieceType.QUEEN, PieceType.ROOK, PieceType.BISHOP, PieceType.KNIGHT);
    }

    @Test
    void greenPawnPromotesOnFileA() {
        Board b = board("b6=gP+", "a7=bR");
        List<Move> moves = pseudo(b, "b6");
        // straight to a6 and capture on a7, four choices each
        assertThat(moves).hasSize(8);
        assertThat(moves).allMatch(m -> m.promotion != null && m.to.file == 0);
    }

    @Test
    void pawnStuckAgainstCornerHasNoForwardMove() {
        Board b = board("b11=rP+");
        assertThat(targets(b, "b11")).isEmpty();
    }

    @Test
    void knightNearCornerIsFilteredByBoardShape() {
        Board b = board("d1=rN");
        assertThat(targets(b, "d1")).containsExactlyInAnyOrder("e3", "f2");
    }

    @Test
    void knightSkipsOwnPieces() {
        Board b = board("h8=rN", "i10=rP", "j9=bP");
        assertThat(targets(b, "h8")).doesNotContain("i10").contains("j9").hasSize(7);
    }

    @Test
    void rookWalksUntilBoardEdge() {
        Board b = board("d1=rR");
        // e1..k1 and d2..d14
        assertThat(targets(b, "d1")).hasSize(7 + 13);
    }

    @Test
    void slidersStopAtFirstPiece() {
        Board b = board("h8=yQ", "h11=yP", "h5=rP", "k8=gB", "e11=bK");
        List<String> t = targets(b, "h8");
        assertThat(t).contains("h9", "h10", "h5", "k8").doesNotContain("h11", "h4", "l8", "e11", "d12");
    }

    @Test
    void bishopStaysOnDiagonals() {
        Board b = board("h8=bB");
        assertThat(pseudo(b, "h8")).allMatch(m -> Math.abs(m.to.file - m.from.file) == Math.abs(m.to.rank - m.from.rank));
    }

    @Test
    void kingStepsOneSquare() {
        Board b = board("h8=gK", "h9=gP", "i9=rP");
        assertThat(targets(b, "h8")).containsExactlyInAnyOrder("g7", "g8", "g9", "h7", "i7", "i8", "i9");
    }

    @Test
    void redCastlesBothWays() {
        Board b = board("h1=rK", "k1=rR", "d1=rR");
        List<Move> castles = pseudo(b, "h1").stream().filter(Move::isCastle).collect(Collectors.toList());
        assertThat(castles).hasSize(2);
        Move kingside = castles.stream().filter(m -> m.kind == MoveKind.CASTLE_KINGSIDE).findFirst().orElseThrow();
        assertThat(kingside.to).isEqualTo(sq("j1"));
        assertThat(kingside.rookFrom).isEqualTo(sq("k1"));
        assertThat(kingside.rookTo).isEqualTo(sq("i1"));
        Move queenside = castles.stream().filter(m -> m.kind == MoveKind.CASTLE_QUEENSIDE).findFirst().orElseThrow();
        assertThat(queenside.to).isEqualTo(sq("f1"));
        assertThat(queenside.rookTo).isEqualTo(sq("g1"));
    }

    @Test
    void yellowKingsideIsTowardsFileD() {
        Board b = board("g14=yK", "d14=yR");
        Move castle = pseudo(b, "g14").stream().filter(Move::isCastle).findFirst().orElseThrow();
        assertThat(castle.kind).isEqualTo(MoveKind.CASTLE_KINGSIDE);
        assertThat(castle.to).isEqualTo(sq("e14"));
        assertThat(castle.rookTo).isEqualTo(sq("f14"));
    }

    @Test
    void blueCastlesAlongFileA() {
        Board b = board("a8=bK", "a11=bR");
        Move castle = pseudo(b, "a8").stream().filter(Move::isCastle).findFirst().orElseThrow();
        assertThat(castle.to).isEqualTo(sq("a10"));
        assertThat(castle.rookTo).isEqualTo(sq("a9"));
    }

    @Test
    void noCastlingAfterKingOrRookMoved() {
        assertThat(pseudo(board("h1=rK+", "k1=rR"), "h1")).noneMatch(Move::isCastle);
        assertThat(pseudo(board("h1=rK", "k1=rR+"), "h1")).noneMatch(Move::isCastle);
        assertThat(pseudo(board("h1=rK", "k1=bR"), "h1")).noneMatch(Move::isCastle);
        assertThat(pseudo(board("h1=rK", "k1=rR", "j1=rN"), "h1")).noneMatch(Move::isCastle);
    }

    @Test
    void enPassantAgainstAdjacentFlaggedPawn() {
        Board b = board("e4=bP+", "f4=rP!");
        List<Move> ep = pseudo(b, "e4").stream().filter(m -> m.kind == MoveKind.EN_PASSANT).collect(Collectors.toList());
        assertThat(ep).hasSize(1);
        assertThat(ep.get(0).to).isEqualTo(sq("f3"));
        assertThat(ep.get(0).capturedAt).isEqualTo(sq("f4"));

        // same geometry without the flag
        b = board("e4=bP+", "f4=rP+");
        assertThat(pseudo(b, "e4")).noneMatch(m -> m.kind == MoveKind.EN_PASSANT);
    }
}
