package pocketcube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * An ordered run of facelet addresses whose colours shift one step forward: the colour at
 * position i ends up at position (i+1) mod n.
 */
public final class PermutationCycle {
    public PermutationCycle(List<FaceletAddress> addresses) {
        if (addresses == null || addresses.size() < 2)
            throw new IllegalArgumentException("a cycle needs at least two addresses");
        Set<FaceletAddress> seen = new HashSet<>();
        for (FaceletAddress address: addresses) {
            if (address == null)
                throw new IllegalArgumentException("a cycle cannot contain null");
            if (!seen.add(address))
                throw new IllegalArgumentException("address " + address + " repeats in cycle " + addresses);
        }
        this.addresses = Collections.unmodifiableList(new ArrayList<>(addresses));
    }

    public static PermutationCycle of(FaceletAddress... addresses) {
        return new PermutationCycle(List.of(addresses));
    }

    public List<FaceletAddress> addresses() {
        return addresses;
    }

    public int length() {
        return addresses.size();
    }

    public FaceletAddress successor(int position) {
        return addresses.get((position+1) % addresses.size());
    }

    public PermutationCycle reversed() {
        List<FaceletAddress> reversed = new ArrayList<>(addresses);
        Collections.reverse(reversed);
        return new PermutationCycle(reversed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PermutationCycle)) return false;
        return addresses.equals(((PermutationCycle) o).addresses);
    }

    @Override
    public int hashCode() {
        return addresses.hashCode();
    }

    @Override
    public String toString() {
        return addresses.toString();
    }

    private final List<FaceletAddress> addresses;
}
