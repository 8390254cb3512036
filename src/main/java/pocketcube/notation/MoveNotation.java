package pocketcube.notation;

import pocketcube.Direction;
import pocketcube.Face;
import pocketcube.Move;
import pocketcube.UnknownMoveTokenException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Single-letter face notation. {@code F} is a clockwise front turn; {@code F'} and {@code f}
 * both turn it counterclockwise.
 */
public final class MoveNotation {
    private MoveNotation() {}

    public static Move parse(String token) {
        if (token == null)
            throw new UnknownMoveTokenException(null);
        String trimmed = token.trim();

        char letter;
        Direction direction;
        if (trimmed.length() == 1) {
            letter = trimmed.charAt(0);
            direction = Character.isLowerCase(letter) ? Direction.COUNTERCLOCKWISE : Direction.CLOCKWISE;
        }
        else if (trimmed.length() == 2 && isPrime(trimmed.charAt(1)) && Character.isUpperCase(trimmed.charAt(0))) {
            letter = trimmed.charAt(0);
            direction = Direction.COUNTERCLOCKWISE;
        }
        else {
            throw new UnknownMoveTokenException(token);
        }

        Face face = Face.fromLetter(letter);
        if (face == null)
            throw new UnknownMoveTokenException(token);
        return Move.of(face, direction);
    }

    /**
     * Parses whitespace-separated tokens. Every token is checked before the list is returned.
     */
    public static List<Move> parseSequence(String text) {
        if (text == null)
            throw new UnknownMoveTokenException(null);
        List<Move> moves = new ArrayList<>();
        for (String token: text.trim().split("\\s+")) {
            if (token.isEmpty())
                continue;
            moves.add(parse(token));
        }
        return Collections.unmodifiableList(moves);
    }

    public static String format(Move move) {
        return move.toString();
    }

    public static String format(List<Move> moves) {
        StringBuilder builder = new StringBuilder();
        for (Move move: moves) {
            if (builder.length() > 0)
                builder.append(' ');
            builder.append(format(move));
        }
        return builder.toString();
    }

    private static boolean isPrime(char c) {
        return c == '\'' || c == '\u2019';
    }
}
