package pocketcube;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pocketcube.notation.MoveNotation;
import pocketcube.scramble.Scrambler;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * One cube being played with. Moves are serialised through a single fair writer lock;
 * readers go straight to the store and always see a whole state.
 *
 * <p>The hooks run under the writer lock, {@code beforeMove} before the move is committed and
 * {@code afterMove} after. A renderer can use them to start an animation for the move it is
 * about to see.
 */
public class CubeSession {
    private static final Logger log = LoggerFactory.getLogger(CubeSession.class);

    public CubeSession(ColorScheme scheme,
                       MoveExecutor executor,
                       Consumer<Move> beforeMove,
                       Consumer<Move> afterMove) {
        if (scheme == null || executor == null)
            throw new IllegalArgumentException("scheme and executor must not be null");
        this.scheme = scheme;
        this.executor = executor;
        this.store = new FaceletStore(CubeState.solved(scheme));
        this.beforeMove = beforeMove == null ? move -> {} : beforeMove;
        this.afterMove = afterMove == null ? move -> {} : afterMove;
        this.writeLock = new ReentrantLock(true);

        log.info("New session with colour scheme {}", scheme);
    }

    public CubeSession(ColorScheme scheme) {
        this(scheme, new MoveExecutor(), null, null);
    }

    public static CubeSession newSession() {
        return new CubeSession(ColorScheme.defaults());
    }

    public CubeState apply(Move move) {
        if (move == null)
            throw new IllegalArgumentException("move must not be null");
        return applySequence(List.of(move));
    }

    public CubeState apply(Face face, Direction direction) {
        return apply(Move.of(face, direction));
    }

    /**
     * Parses and applies a move sequence written in notation. An unknown token rejects the
     * whole text and leaves the cube as it was.
     */
    public CubeState apply(String notation) {
        return applySequence(MoveNotation.parseSequence(notation));
    }

    /**
     * Applies the moves in order. If a hook throws part way through, the state goes back to
     * what it was before the first move and the exception propagates.
     */
    public CubeState applySequence(List<Move> moves) {
        MoveExecutor.checkSequence(moves);
        writeLock.lock();
        try {
            CubeState before = store.snapshot();
            try {
                for (Move move: moves) {
                    commit(move);
                }
            }
            catch (RuntimeException e) {
                store.setAll(before);
                log.warn("Sequence {} aborted, state restored", MoveNotation.format(moves), e);
                throw e;
            }
            return store.snapshot();
        }
        finally {
            writeLock.unlock();
        }
    }

    public List<Move> scramble(Scrambler scrambler) {
        List<Move> moves = scrambler.next();
        applySequence(moves);
        log.info("Scrambled with {}", MoveNotation.format(moves));
        return moves;
    }

    public void reset() {
        writeLock.lock();
        try {
            store.setAll(CubeState.solved(scheme));
        }
        finally {
            writeLock.unlock();
        }
        log.info("Session reset to solved state");
    }

    public CubeState snapshot() {
        return store.snapshot();
    }

    public Color faceletColor(Face face, int row, int column) {
        return store.get(face, row, column);
    }

    public boolean isSolved() {
        return store.isSolved();
    }

    public ColorScheme scheme() {
        return scheme;
    }

    public MoveExecutor executor() {
        return executor;
    }

    private void commit(Move move) {
        beforeMove.accept(move);
        store.setAll(executor.apply(store.snapshot(), move));
        log.debug("Applied {}", move);
        afterMove.accept(move);
    }

    private final ColorScheme scheme;
    private final MoveExecutor executor;
    private final FaceletStore store;

    private final Consumer<Move> beforeMove;
    private final Consumer<Move> afterMove;

    private final ReentrantLock writeLock;
}
