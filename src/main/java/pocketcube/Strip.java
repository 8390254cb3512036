package pocketcube;

/**
 * A walk along one edge of a 2x2 face grid, named after the edge and the way it is walked
 * (UL: upper edge towards the left, LD: left edge downwards, and so on). Offset 0 is the
 * first facelet of the walk, offset 1 the second.
 */
public enum Strip {
    UL, UR, LD, LU, DR, DL, RU, RD;

    public int row(int offset) {
        switch (this) {
            case UL: case UR: return 0;
            case LD: case RD: return offset;
            case LU: case RU: return 1-offset;
            case DR: case DL: return 1;
            default: return -1;
        }
    }

    public int column(int offset) {
        switch (this) {
            case LD: case LU: return 0;
            case UR: case DR: return offset;
            case UL: case DL: return 1-offset;
            case RU: case RD: return 1;
            default: return -1;
        }
    }

    public FaceletAddress address(Face face, int offset) {
        return FaceletAddress.of(face, row(offset), column(offset));
    }
}
