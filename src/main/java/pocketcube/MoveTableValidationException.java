package pocketcube;

public class MoveTableValidationException extends PocketCubeException {
    public MoveTableValidationException(Move move, String message) {
        super(move == null ? message : move + ": " + message);
        this.move = move;
    }

    /**
     * The move whose table is inconsistent, or null when the failure concerns the tables as a whole.
     */
    public Move move() {
        return move;
    }

    private final Move move;
}
