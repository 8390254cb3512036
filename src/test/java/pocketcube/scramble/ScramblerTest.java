package pocketcube.scramble;

import org.junit.jupiter.api.*;
import pocketcube.Move;

import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ScramblerTest {
    @Test
    @DisplayName("The same seed gives the same scramble.")
    void testSeeded() {
        List<Move> first = new Scrambler(30, 17L).next();
        List<Move> second = new Scrambler(30, 17L).next();
        assertEquals(30, first.size());
        assertEquals(first, second);
    }

    @Test
    @DisplayName("By default a scramble is ten moves long.")
    void testDefaultLength() {
        Scrambler scrambler = new Scrambler();
        assertEquals(Scrambler.DEFAULT_LENGTH, scrambler.length());
        assertEquals(10, scrambler.next().size());
    }

    @Test
    @DisplayName("Long scrambles use all twelve moves.")
    void testCoverage() {
        List<Move> moves = new Scrambler(2000, new Random(1)).next();
        assertEquals(new HashSet<>(Move.all()), new HashSet<>(moves));
    }

    @Test
    @DisplayName("Zero length is allowed, negative is not.")
    void testLengthBounds() {
        assertEquals(List.of(), new Scrambler(0, 3L).next());
        assertThrows(IllegalArgumentException.class, () -> new Scrambler(-1, 3L));
        assertThrows(IllegalArgumentException.class, () -> new Scrambler(5, (Random) null));
    }
}
