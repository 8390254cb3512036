package pocketcube.scramble;

import pocketcube.Move;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Draws uniformly random moves. Give it a seeded {@link Random} for a repeatable scramble.
 */
public class Scrambler {
    public static final int DEFAULT_LENGTH = 10;

    public Scrambler(int length, Random random) {
        if (length < 0)
            throw new IllegalArgumentException("scramble length must not be negative, got " + length);
        if (random == null)
            throw new IllegalArgumentException("random must not be null");
        this.length = length;
        this.random = random;
    }

    public Scrambler(int length, Long seed) {
        this(length, seed == null ? new Random() : new Random(seed));
    }

    public Scrambler() {
        this(DEFAULT_LENGTH, (Long) null);
    }

    public List<Move> next() {
        List<Move> all = Move.all();
        List<Move> moves = new ArrayList<>(length);
        synchronized (random) {
            for (int idx = 0; idx < length; ++idx) {
                moves.add(all.get(random.nextInt(all.size())));
            }
        }
        return Collections.unmodifiableList(moves);
    }

    public int length() {
        return length;
    }

    private final int length;
    private final Random random;
}
