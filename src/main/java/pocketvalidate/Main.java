package pocketvalidate;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pocketcube.CubeSession;
import pocketcube.CubeState;
import pocketcube.Face;
import pocketcube.Move;
import pocketcube.MoveTableValidationException;
import pocketcube.UnknownMoveTokenException;
import pocketcube.config.ConfigLoader;
import pocketcube.config.EngineConfig;
import pocketcube.notation.MoveNotation;

import java.util.List;

/**
 * Applies a move sequence given on the command line (or a configured scramble when there is
 * none) to a fresh cube and prints the resulting net.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static String prettyPrintCube(CubeState state) {
        String sp = " ".repeat(2);

        // DOWN is stored as seen from above; the net shows it from below, so columns flip.
        String flat = sp + row(state, Face.UP, 0, false) + sp + sp + "\n"
                + sp + row(state, Face.UP, 1, false) + sp + sp + "\n"
                + row(state, Face.LEFT, 0, false) + row(state, Face.FRONT, 0, false)
                + row(state, Face.RIGHT, 0, false) + row(state, Face.BACK, 0, false) + "\n"
                + row(state, Face.LEFT, 1, false) + row(state, Face.FRONT, 1, false)
                + row(state, Face.RIGHT, 1, false) + row(state, Face.BACK, 1, false) + "\n"
                + sp + row(state, Face.DOWN, 0, true) + sp + sp + "\n"
                + sp + row(state, Face.DOWN, 1, true) + sp + sp + "\n";

        StringBuilder builder = new StringBuilder();
        for (Character c: flat.toCharArray()) {
            if (c != '\n')
                builder.append(' ');
            builder.append(c);
        }

        return builder.toString();
    }

    private static String row(CubeState state, Face face, int row, boolean flipped) {
        char left = state.color(face, row, flipped ? 1 : 0).code();
        char right = state.color(face, row, flipped ? 0 : 1).code();
        return "" + left + right;
    }

    static int run(String[] args, EngineConfig config) {
        CubeSession session = new CubeSession(config.toColorScheme());

        List<Move> moves;
        try {
            if (args.length == 0) {
                moves = session.scramble(config.newScrambler());
            }
            else {
                moves = MoveNotation.parseSequence(String.join(" ", args));
                session.applySequence(moves);
            }
        }
        catch (UnknownMoveTokenException e) {
            log.error("Rejected move sequence: {}", e.getMessage());
            return 1;
        }

        System.out.println("Moves: " + MoveNotation.format(moves));
        System.out.println(prettyPrintCube(session.snapshot()));
        System.out.printf("Solved: %b%n", session.isSolved());
        return 0;
    }

    public static void main(String[] args) {
        EngineConfig config = ConfigLoader.load(new ObjectMapper());
        int status;
        try {
            status = run(args, config);
        }
        catch (MoveTableValidationException e) {
            log.error("Refusing to start: {}", e.getMessage());
            status = 2;
        }
        System.exit(status);
    }
}
