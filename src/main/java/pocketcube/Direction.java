package pocketcube;

public enum Direction {
    CLOCKWISE, COUNTERCLOCKWISE;

    public Direction opposite() {
        return this == CLOCKWISE ? COUNTERCLOCKWISE : CLOCKWISE;
    }
}
