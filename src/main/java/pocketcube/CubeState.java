package pocketcube;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable assignment of a colour to every one of the 24 facelets.
 *
 * <p>States are values: two states are equal when every facelet holds the same colour. The
 * engine never hands out anything that could change a state after it was built.
 */
public final class CubeState {
    private CubeState(Color[] colors) {
        this.colors = colors;
    }

    public static CubeState solved(ColorScheme scheme) {
        Color[] colors = new Color[FaceletAddress.COUNT];
        for (FaceletAddress address: FaceletAddress.all()) {
            colors[address.index()] = scheme.colorOf(address.face());
        }
        return new CubeState(colors);
    }

    public static CubeState solved() {
        return solved(ColorScheme.defaults());
    }

    /**
     * Builds a state from an explicit assignment. The assignment must cover all 24 facelets;
     * whether the state could be reached by turning a real cube is not checked.
     */
    public static CubeState of(Map<FaceletAddress, Color> assignment) {
        if (assignment == null)
            throw new IllegalArgumentException("assignment must not be null");
        Color[] colors = new Color[FaceletAddress.COUNT];
        for (FaceletAddress address: FaceletAddress.all()) {
            Color color = assignment.get(address);
            if (color == null)
                throw new IllegalArgumentException("no colour for facelet " + address);
            colors[address.index()] = color;
        }
        return new CubeState(colors);
    }

    // Takes ownership of the array.
    static CubeState wrap(Color[] colors) {
        return new CubeState(colors);
    }

    public Color color(FaceletAddress address) {
        return colors[address.index()];
    }

    public Color color(Face face, int row, int column) {
        return color(FaceletAddress.of(face, row, column));
    }

    public List<Color> faceColors(Face face) {
        int base = FaceletAddress.of(face, 0, 0).index();
        return Collections.unmodifiableList(Arrays.asList(Arrays.copyOfRange(colors, base, base+4)));
    }

    public Map<FaceletAddress, Color> asMap() {
        Map<FaceletAddress, Color> map = new LinkedHashMap<>();
        for (FaceletAddress address: FaceletAddress.all()) {
            map.put(address, colors[address.index()]);
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * True when every face is a single colour and no two faces share one.
     */
    public boolean isSolved() {
        Set<Color> faceColors = EnumSet.noneOf(Color.class);
        for (Face face: Face.values()) {
            int base = FaceletAddress.of(face, 0, 0).index();
            Color color = colors[base];
            for (int offset = 1; offset < 4; ++offset) {
                if (colors[base+offset] != color)
                    return false;
            }
            if (!faceColors.add(color))
                return false;
        }
        return true;
    }

    Color[] toArray() {
        return colors.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CubeState)) return false;
        return Arrays.equals(colors, ((CubeState) o).colors);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(colors);
    }

    /**
     * The colour codes of all facelets in address order, four per face: U, D, F, B, L, R.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(FaceletAddress.COUNT);
        for (Color color: colors) {
            builder.append(color.code());
        }
        return builder.toString();
    }

    private final Color[] colors;
}
