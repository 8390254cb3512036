package pocketcube;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One of the 24 facelet positions. Instances are interned, so identity comparison is safe.
 */
public final class FaceletAddress {
    public static final int COUNT = 6*2*2;

    private FaceletAddress(Face face, int row, int column) {
        this.face = face;
        this.row = row;
        this.column = column;
    }

    public static FaceletAddress of(Face face, int row, int column) {
        if (face == null)
            throw new IllegalArgumentException("face must not be null");
        if (row < 0 || row > 1 || column < 0 || column > 1)
            throw new InvalidFaceletQueryException(face, row, column);
        return addresses[index(face, row, column)];
    }

    public static FaceletAddress ofIndex(int index) {
        return addresses[index];
    }

    public static List<FaceletAddress> all() {
        return ALL;
    }

    public static List<FaceletAddress> onFace(Face face) {
        int base = index(face, 0, 0);
        return ALL.subList(base, base+4);
    }

    public Face face() {
        return face;
    }

    public int row() {
        return row;
    }

    public int column() {
        return column;
    }

    public int index() {
        return index(face, row, column);
    }

    @Override
    public String toString() {
        return "" + face.letter() + row + column;
    }

    private static int index(Face face, int row, int column) {
        return column + 2 * (row + 2 * face.ordinal());
    }

    private static final FaceletAddress[] addresses;
    private static final List<FaceletAddress> ALL;
    static {
        addresses = new FaceletAddress[COUNT];
        for (Face face: Face.values()) {
            for (int row = 0; row < 2; ++row) {
                for (int column = 0; column < 2; ++column) {
                    addresses[index(face, row, column)] = new FaceletAddress(face, row, column);
                }
            }
        }
        ALL = Collections.unmodifiableList(Arrays.asList(addresses));
    }

    private final Face face;
    private final int row, column;
}
