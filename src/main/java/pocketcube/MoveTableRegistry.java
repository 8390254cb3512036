package pocketcube;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Holds the permutation table of each of the twelve moves.
 *
 * <p>The process-wide instance is derived from the adjacency tables on {@link Face}: for a
 * turned face the two-facelet strip of every neighbour flows into the next neighbour, and the
 * face's own four facelets turn in the same rotational sense. Counterclockwise tables are the
 * clockwise cycles reversed. Every table is checked once, when the registry is built; a
 * registry that fails a check is never handed out.
 */
public final class MoveTableRegistry {
    private static final Logger log = LoggerFactory.getLogger(MoveTableRegistry.class);

    public static synchronized MoveTableRegistry getInstance() {
        if (instance == null)
            instance = new MoveTableRegistry(deriveCycles());
        return instance;
    }

    MoveTableRegistry(Map<Move, List<PermutationCycle>> cycles) {
        Map<Move, MoveTable> tables = new LinkedHashMap<>();
        for (Move move: Move.all()) {
            List<PermutationCycle> moveCycles = cycles.get(move);
            if (moveCycles == null)
                throw fail(move, "no table");
            tables.put(move, new MoveTable(move, moveCycles));
        }
        validate(tables);
        this.tables = Collections.unmodifiableMap(tables);
        log.debug("Move tables validated for {} moves", tables.size());
    }

    public MoveTable table(Move move) {
        return tables.get(move);
    }

    public MoveTable table(Face face, Direction direction) {
        return tables.get(Move.of(face, direction));
    }

    public Map<Move, MoveTable> tables() {
        return tables;
    }

    static Map<Move, List<PermutationCycle>> deriveCycles() {
        Map<Move, List<PermutationCycle>> cycles = new LinkedHashMap<>();
        for (Face face: Face.values()) {
            List<PermutationCycle> clockwise = new ArrayList<>();

            Strip[] corners = face.cornerWalk();
            List<FaceletAddress> own = new ArrayList<>();
            for (Strip corner: corners) {
                own.add(corner.address(face, 0));
            }
            clockwise.add(new PermutationCycle(own));

            Face[] rotatedSides = face.rotatedSides();
            Strip[] strips = face.strips();
            for (int offset = 0; offset < 2; ++offset) {
                List<FaceletAddress> side = new ArrayList<>();
                for (int rotatedIdx = 0; rotatedIdx < rotatedSides.length; ++rotatedIdx) {
                    side.add(strips[rotatedIdx].address(rotatedSides[rotatedIdx], offset));
                }
                clockwise.add(new PermutationCycle(side));
            }

            List<PermutationCycle> counterclockwise = new ArrayList<>();
            for (PermutationCycle cycle: clockwise) {
                counterclockwise.add(cycle.reversed());
            }

            cycles.put(Move.clockwise(face), clockwise);
            cycles.put(Move.counterclockwise(face), counterclockwise);
        }
        return cycles;
    }

    private static void validate(Map<Move, MoveTable> tables) {
        Set<FaceletAddress> referenced = new HashSet<>();
        Map<Face, MoveTable> clockwise = new EnumMap<>(Face.class);
        for (MoveTable table: tables.values()) {
            checkShape(table);
            referenced.addAll(table.workingSet());
            if (table.move().direction() == Direction.CLOCKWISE)
                clockwise.put(table.move().face(), table);
        }

        for (Map.Entry<Face, MoveTable> entry: clockwise.entrySet()) {
            MoveTable forward = entry.getValue();
            MoveTable backward = tables.get(Move.counterclockwise(entry.getKey()));
            checkInverse(forward, backward);
            checkOrder(forward);
            checkOrder(backward);
        }

        if (referenced.size() != FaceletAddress.COUNT)
            throw fail(null, "tables reference " + referenced.size() + " of " + FaceletAddress.COUNT + " facelets");
    }

    private static void checkShape(MoveTable table) {
        Move move = table.move();
        for (PermutationCycle cycle: table.cycles()) {
            if (cycle.length() != 4)
                throw fail(move, "cycle " + cycle + " has length " + cycle.length() + ", expected 4");
        }
        if (table.workingSet().size() != 12)
            throw fail(move, "working set has " + table.workingSet().size() + " facelets, expected 12");

        int own = 0;
        for (FaceletAddress address: table.workingSet()) {
            if (address.face() == move.face())
                ++own;
        }
        if (own != 4)
            throw fail(move, "turns " + own + " of its own facelets, expected 4");
    }

    private static void checkInverse(MoveTable forward, MoveTable backward) {
        int[] there = forward.destinations();
        int[] back = backward.destinations();
        for (int index = 0; index < there.length; ++index) {
            if (back[there[index]] != index)
                throw fail(backward.move(), "does not undo " + forward.move() + " at " + FaceletAddress.ofIndex(index));
        }
    }

    private static void checkOrder(MoveTable table) {
        int[] destinations = table.destinations();
        for (int index = 0; index < destinations.length; ++index) {
            int position = index;
            for (int turn = 0; turn < 4; ++turn) {
                position = destinations[position];
            }
            if (position != index)
                throw fail(table.move(), "four turns move " + FaceletAddress.ofIndex(index) + " to " + FaceletAddress.ofIndex(position));
        }
    }

    private static MoveTableValidationException fail(Move move, String message) {
        MoveTableValidationException e = new MoveTableValidationException(move, message);
        log.error("Move table check failed: {}", e.getMessage());
        return e;
    }

    private static MoveTableRegistry instance;

    private final Map<Move, MoveTable> tables;
}
