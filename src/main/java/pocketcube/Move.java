package pocketcube;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A quarter turn of one face. The twelve instances are interned.
 */
public final class Move {
    private Move(Face face, Direction direction) {
        this.face = face;
        this.direction = direction;
    }

    public static Move of(Face face, Direction direction) {
        if (face == null || direction == null)
            throw new IllegalArgumentException("face and direction must not be null");
        return moves[index(face, direction)];
    }

    public static Move clockwise(Face face) {
        return of(face, Direction.CLOCKWISE);
    }

    public static Move counterclockwise(Face face) {
        return of(face, Direction.COUNTERCLOCKWISE);
    }

    public static List<Move> all() {
        return ALL;
    }

    public Face face() {
        return face;
    }

    public Direction direction() {
        return direction;
    }

    public Move inverse() {
        return of(face, direction.opposite());
    }

    @Override
    public String toString() {
        return direction == Direction.CLOCKWISE ? String.valueOf(face.letter()) : face.letter() + "'";
    }

    private static int index(Face face, Direction direction) {
        return 2 * face.ordinal() + direction.ordinal();
    }

    private static final Move[] moves;
    private static final List<Move> ALL;
    static {
        moves = new Move[2 * Face.values().length];
        for (Face face: Face.values()) {
            for (Direction direction: Direction.values()) {
                moves[index(face, direction)] = new Move(face, direction);
            }
        }
        ALL = Collections.unmodifiableList(Arrays.asList(moves));
    }

    private final Face face;
    private final Direction direction;
}
