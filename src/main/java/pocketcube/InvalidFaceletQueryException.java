package pocketcube;

public class InvalidFaceletQueryException extends PocketCubeException {
    public InvalidFaceletQueryException(Face face, int row, int column) {
        super(String.format("No facelet at %s row %d column %d, rows and columns are 0 or 1", face, row, column));
        this.face = face;
        this.row = row;
        this.column = column;
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

    private final Face face;
    private final int row, column;
}
