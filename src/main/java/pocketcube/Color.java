package pocketcube;

public enum Color {
    WHITE('W'), YELLOW('Y'), RED('R'), ORANGE('O'), BLUE('B'), GREEN('G');

    Color(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    private final char code;
}
