package pocketcube;

public class UnknownMoveTokenException extends PocketCubeException {
    public UnknownMoveTokenException(String token) {
        super("Unknown move token: '" + token + "'");
        this.token = token;
    }

    public String token() {
        return token;
    }

    private final String token;
}
