package pocketcube;

import org.junit.jupiter.api.*;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CubeStateTest {
    @Nested
    @DisplayName("Facelet addresses.")
    class Addresses {
        @Test
        @DisplayName("There are exactly 24 distinct addresses with dense indices.")
        void testAddressSpace() {
            List<FaceletAddress> all = FaceletAddress.all();
            assertEquals(24, all.size());
            assertEquals(24, new HashSet<>(all).size());
            for (int index = 0; index < all.size(); ++index) {
                assertEquals(index, all.get(index).index());
                assertSame(all.get(index), FaceletAddress.ofIndex(index));
            }
        }

        @Test
        @DisplayName("Addresses are interned.")
        void testInterned() {
            assertSame(FaceletAddress.of(Face.LEFT, 1, 0), FaceletAddress.of(Face.LEFT, 1, 0));
            assertEquals("L10", FaceletAddress.of(Face.LEFT, 1, 0).toString());
        }

        @Test
        @DisplayName("Rows and columns outside 0..1 are rejected.")
        void testOutOfRange() {
            InvalidFaceletQueryException e = assertThrows(InvalidFaceletQueryException.class,
                    () -> FaceletAddress.of(Face.UP, 2, 0));
            assertEquals(Face.UP, e.face());
            assertEquals(2, e.row());
            assertThrows(InvalidFaceletQueryException.class, () -> FaceletAddress.of(Face.UP, 0, -1));
            assertThrows(InvalidFaceletQueryException.class, () -> CubeState.solved().color(Face.BACK, -1, 1));
        }
    }

    @Nested
    @DisplayName("Solvedness.")
    class Solvedness {
        @Test
        @DisplayName("The solved state shows the scheme's colour on every face.")
        void testSolvedState() {
            CubeState solved = CubeState.solved();
            assertTrue(solved.isSolved());
            for (Face face: Face.values()) {
                Color expected = ColorScheme.defaults().colorOf(face);
                assertEquals(List.of(expected, expected, expected, expected), solved.faceColors(face));
            }
            assertEquals("WWWWYYYYRRRROOOOGGGGBBBB", solved.toString());
        }

        @Test
        @DisplayName("Uniform faces that share a colour are not solved.")
        void testSharedColourNotSolved() {
            Map<FaceletAddress, Color> assignment = new HashMap<>(CubeState.solved().asMap());
            for (FaceletAddress address: FaceletAddress.onFace(Face.DOWN)) {
                assignment.put(address, Color.WHITE);
            }
            assertFalse(CubeState.of(assignment).isSolved());
        }

        @Test
        @DisplayName("A single odd facelet makes the state unsolved.")
        void testSingleFaceletNotSolved() {
            Map<FaceletAddress, Color> assignment = new HashMap<>(CubeState.solved().asMap());
            assignment.put(FaceletAddress.of(Face.RIGHT, 1, 1), Color.ORANGE);
            assertFalse(CubeState.of(assignment).isSolved());
        }

        @Test
        @DisplayName("Any scheme with six distinct colours gives a solved state.")
        void testOtherScheme() {
            Map<Face, Color> colors = new EnumMap<>(Face.class);
            Color[] palette = Color.values();
            for (Face face: Face.values()) {
                colors.put(face, palette[palette.length - 1 - face.ordinal()]);
            }
            CubeState solved = CubeState.solved(ColorScheme.of(colors));
            assertTrue(solved.isSolved());
            assertNotEquals(CubeState.solved(), solved);
        }
    }

    @Nested
    @DisplayName("Value semantics.")
    class Values {
        @Test
        @DisplayName("States with the same colours are equal.")
        void testEquality() {
            CubeState state = States.random(new Random(5));
            CubeState copy = CubeState.of(state.asMap());
            assertEquals(state, copy);
            assertEquals(state.hashCode(), copy.hashCode());
            assertEquals(state, States.parse(state.toString()));
        }

        @Test
        @DisplayName("Views handed out cannot change the state.")
        void testReadOnlyViews() {
            CubeState state = CubeState.solved();
            assertThrows(UnsupportedOperationException.class,
                    () -> state.asMap().put(FaceletAddress.of(Face.UP, 0, 0), Color.RED));
            assertThrows(UnsupportedOperationException.class,
                    () -> state.faceColors(Face.UP).set(0, Color.RED));
            assertTrue(state.isSolved());
        }

        @Test
        @DisplayName("Partial assignments are rejected.")
        void testPartialAssignment() {
            Map<FaceletAddress, Color> assignment = new HashMap<>(CubeState.solved().asMap());
            assignment.remove(FaceletAddress.of(Face.FRONT, 0, 1));
            assertThrows(IllegalArgumentException.class, () -> CubeState.of(assignment));
        }
    }

    @Nested
    @DisplayName("Colour schemes.")
    class Schemes {
        @Test
        @DisplayName("Incomplete or repeating schemes are rejected.")
        void testInvalidSchemes() {
            Map<Face, Color> colors = new EnumMap<>(ColorScheme.defaults().asMap());
            colors.remove(Face.BACK);
            assertThrows(IllegalArgumentException.class, () -> ColorScheme.of(colors));

            colors.put(Face.BACK, Color.WHITE);
            assertThrows(IllegalArgumentException.class, () -> ColorScheme.of(colors));
        }
    }
}
