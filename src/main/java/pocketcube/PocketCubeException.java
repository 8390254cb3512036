package pocketcube;

/**
 * Base class of every error the engine reports. All of them come from malformed input at
 * the engine boundary or from a move table that failed its startup checks.
 */
public class PocketCubeException extends RuntimeException {
    public PocketCubeException(String message) {
        super(message);
    }

    public PocketCubeException(String message, Throwable cause) {
        super(message, cause);
    }
}
