package pocketcube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Applies moves to states. Every result is computed from the unchanged input state and
 * returned as a new state, so the permutation is never applied facelet by facelet to live data.
 */
public final class MoveExecutor {
    public MoveExecutor() {
        this(MoveTableRegistry.getInstance());
    }

    public MoveExecutor(MoveTableRegistry registry) {
        if (registry == null)
            throw new IllegalArgumentException("registry must not be null");
        this.registry = registry;
    }

    public CubeState apply(CubeState state, Move move) {
        if (state == null || move == null)
            throw new IllegalArgumentException("state and move must not be null");

        MoveTable table = registry.table(move);
        Color[] colors = state.toArray();
        for (PermutationCycle cycle: table.cycles()) {
            List<FaceletAddress> addresses = cycle.addresses();
            for (int position = 0; position < addresses.size(); ++position) {
                colors[cycle.successor(position).index()] = state.color(addresses.get(position));
            }
        }
        return CubeState.wrap(colors);
    }

    public CubeState apply(CubeState state, Face face, Direction direction) {
        return apply(state, Move.of(face, direction));
    }

    /**
     * Applies the moves left to right. The whole list is checked first, so a bad element
     * rejects the sequence before any move is made.
     */
    public CubeState applySequence(CubeState state, List<Move> moves) {
        if (state == null)
            throw new IllegalArgumentException("state must not be null");
        checkSequence(moves);

        CubeState current = state;
        for (Move move: moves) {
            current = apply(current, move);
        }
        return current;
    }

    public Move inverse(Move move) {
        return move.inverse();
    }

    public List<Move> inverseSequence(List<Move> moves) {
        checkSequence(moves);
        List<Move> inverse = new ArrayList<>(moves.size());
        for (int idx = moves.size()-1; idx >= 0; --idx) {
            inverse.add(moves.get(idx).inverse());
        }
        return Collections.unmodifiableList(inverse);
    }

    public boolean isSolved(CubeState state) {
        return state.isSolved();
    }

    public MoveTableRegistry registry() {
        return registry;
    }

    static void checkSequence(List<Move> moves) {
        if (moves == null)
            throw new IllegalArgumentException("move sequence must not be null");
        for (int idx = 0; idx < moves.size(); ++idx) {
            if (moves.get(idx) == null)
                throw new IllegalArgumentException("move " + idx + " of the sequence is null");
        }
    }

    private final MoveTableRegistry registry;
}
