package pocketcube.notation;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import pocketcube.Direction;
import pocketcube.Face;
import pocketcube.Move;
import pocketcube.UnknownMoveTokenException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MoveNotationTest {
    @ParameterizedTest
    @EnumSource(Face.class)
    @DisplayName("Each face letter parses in all three spellings.")
    void testSpellings(Face face) {
        String letter = String.valueOf(face.letter());
        assertEquals(Move.of(face, Direction.CLOCKWISE), MoveNotation.parse(letter));
        assertEquals(Move.of(face, Direction.COUNTERCLOCKWISE), MoveNotation.parse(letter + "'"));
        assertEquals(Move.of(face, Direction.COUNTERCLOCKWISE), MoveNotation.parse(letter.toLowerCase()));
        assertEquals(Move.of(face, Direction.COUNTERCLOCKWISE), MoveNotation.parse(letter + "’"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "X", "x", "FF", "F2", "f'", "'F", "U''", "Up"})
    @DisplayName("Anything else is an unknown token.")
    void testUnknownTokens(String token) {
        UnknownMoveTokenException e = assertThrows(UnknownMoveTokenException.class, () -> MoveNotation.parse(token));
        assertEquals(token, e.token());
    }

    @Test
    @DisplayName("Null is an unknown token.")
    void testNull() {
        assertThrows(UnknownMoveTokenException.class, () -> MoveNotation.parse(null));
        assertThrows(UnknownMoveTokenException.class, () -> MoveNotation.parseSequence(null));
    }

    @Test
    @DisplayName("Sequences split on any whitespace.")
    void testSequence() {
        assertEquals(List.of(
                Move.clockwise(Face.RIGHT),
                Move.counterclockwise(Face.UP),
                Move.counterclockwise(Face.FRONT),
                Move.clockwise(Face.DOWN)), MoveNotation.parseSequence("  R U'\tf\n D "));
        assertEquals(List.of(), MoveNotation.parseSequence("   "));
    }

    @Test
    @DisplayName("One bad token rejects the whole sequence.")
    void testBadSequence() {
        UnknownMoveTokenException e = assertThrows(UnknownMoveTokenException.class,
                () -> MoveNotation.parseSequence("R U Q D"));
        assertEquals("Q", e.token());
    }

    @Test
    @DisplayName("Formatting uses capital letters and primes and parses back.")
    void testFormat() {
        List<Move> moves = List.of(
                Move.clockwise(Face.BACK),
                Move.counterclockwise(Face.LEFT),
                Move.clockwise(Face.FRONT));
        assertEquals("B L' F", MoveNotation.format(moves));
        assertEquals("L'", MoveNotation.format(Move.counterclockwise(Face.LEFT)));
        assertEquals(moves, MoveNotation.parseSequence(MoveNotation.format(moves)));
    }
}
