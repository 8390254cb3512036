package pocketcube;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The disjoint cycles a single move applies, flattened into a destination index per facelet.
 */
public final class MoveTable {
    MoveTable(Move move, List<PermutationCycle> cycles) {
        this.move = move;
        this.cycles = Collections.unmodifiableList(new ArrayList<>(cycles));

        List<FaceletAddress> workingSet = new ArrayList<>();
        destinations = new int[FaceletAddress.COUNT];
        Arrays.fill(destinations, -1);
        for (PermutationCycle cycle: cycles) {
            List<FaceletAddress> addresses = cycle.addresses();
            for (int position = 0; position < addresses.size(); ++position) {
                FaceletAddress address = addresses.get(position);
                if (destinations[address.index()] != -1)
                    throw new MoveTableValidationException(move, "address " + address + " appears in two cycles");
                destinations[address.index()] = cycle.successor(position).index();
                workingSet.add(address);
            }
        }
        for (int index = 0; index < destinations.length; ++index) {
            if (destinations[index] == -1)
                destinations[index] = index;
        }
        this.workingSet = Collections.unmodifiableList(workingSet);
    }

    public Move move() {
        return move;
    }

    public List<PermutationCycle> cycles() {
        return cycles;
    }

    public List<FaceletAddress> workingSet() {
        return workingSet;
    }

    public boolean touches(FaceletAddress address) {
        return destinations[address.index()] != address.index();
    }

    /**
     * Where the colour currently at {@code address} goes. Untouched facelets map to themselves.
     */
    public FaceletAddress destinationOf(FaceletAddress address) {
        return FaceletAddress.ofIndex(destinations[address.index()]);
    }

    int[] destinations() {
        return destinations.clone();
    }

    @Override
    public String toString() {
        return move + " " + cycles;
    }

    private final Move move;
    private final List<PermutationCycle> cycles;
    private final List<FaceletAddress> workingSet;
    private final int[] destinations;
}
