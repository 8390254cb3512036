package pocketcube;

/**
 * Holds the live state of one session. The state is replaced as a whole, never edited in
 * place, so a reader sees either the state before a move or the state after it.
 */
public final class FaceletStore {
    public FaceletStore(CubeState initial) {
        if (initial == null)
            throw new IllegalArgumentException("initial state must not be null");
        this.state = initial;
    }

    public Color get(FaceletAddress address) {
        return state.color(address);
    }

    public Color get(Face face, int row, int column) {
        return state.color(FaceletAddress.of(face, row, column));
    }

    void setAll(CubeState next) {
        if (next == null)
            throw new IllegalArgumentException("state must not be null");
        state = next;
    }

    public CubeState snapshot() {
        return state;
    }

    public boolean isSolved() {
        return state.isSolved();
    }

    private volatile CubeState state;
}
