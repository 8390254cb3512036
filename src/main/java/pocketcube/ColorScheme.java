package pocketcube;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The colour each face shows in the solved state. Always complete, always six distinct colours.
 */
public final class ColorScheme {
    private static final ColorScheme DEFAULT;
    static {
        Map<Face, Color> colors = new EnumMap<>(Face.class);
        colors.put(Face.UP, Color.WHITE);
        colors.put(Face.DOWN, Color.YELLOW);
        colors.put(Face.FRONT, Color.RED);
        colors.put(Face.BACK, Color.ORANGE);
        colors.put(Face.RIGHT, Color.BLUE);
        colors.put(Face.LEFT, Color.GREEN);
        DEFAULT = new ColorScheme(colors);
    }

    private ColorScheme(Map<Face, Color> colors) {
        this.colors = Collections.unmodifiableMap(new EnumMap<>(colors));
    }

    public static ColorScheme defaults() {
        return DEFAULT;
    }

    public static ColorScheme of(Map<Face, Color> colors) {
        if (colors == null)
            throw new IllegalArgumentException("colour scheme must not be null");
        Set<Color> used = EnumSet.noneOf(Color.class);
        for (Face face: Face.values()) {
            Color color = colors.get(face);
            if (color == null)
                throw new IllegalArgumentException("no colour for face " + face);
            if (!used.add(color))
                throw new IllegalArgumentException("colour " + color + " used on more than one face");
        }
        return new ColorScheme(colors);
    }

    public Color colorOf(Face face) {
        return colors.get(face);
    }

    public Map<Face, Color> asMap() {
        return colors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColorScheme)) return false;
        return colors.equals(((ColorScheme) o).colors);
    }

    @Override
    public int hashCode() {
        return colors.hashCode();
    }

    @Override
    public String toString() {
        return colors.toString();
    }

    private final Map<Face, Color> colors;
}
