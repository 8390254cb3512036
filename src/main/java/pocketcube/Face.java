package pocketcube;

import static pocketcube.Strip.*;

/**
 * The six faces of the cube together with the fixed adjacency tables every move table is
 * derived from.
 */
public enum Face {
    UP('U'), DOWN('D'), FRONT('F'), BACK('B'), LEFT('L'), RIGHT('R');

    Face(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    public static Face fromLetter(char letter) {
        for (Face face: values()) {
            if (face.letter == Character.toUpperCase(letter))
                return face;
        }
        return null;
    }

    final static int[] oppositeArray = {
            1, 0, 3, 2, 5, 4
    };

    public Face opposite() {
        return values()[oppositeArray[ordinal()]];
    }

    // +1 when the grid is read from outside the cube, -1 for the mirrored DOWN grid.
    final static int[] parityArray = {
            1, -1, 1, 1, 1, 1
    };

    public int parity() {
        return parityArray[ordinal()];
    }

    // Neighbours in the order colours flow on a clockwise turn.
    static Face[][] rotatedSidesArray = {
            { BACK, RIGHT, FRONT, LEFT },
            { BACK, LEFT, FRONT, RIGHT },
            { DOWN, LEFT, UP, RIGHT },
            { DOWN, RIGHT, UP, LEFT },
            { BACK, UP, FRONT, DOWN },
            { BACK, DOWN, FRONT, UP }
    };

    public Face[] rotatedSides() {
        return rotatedSidesArray[ordinal()].clone();
    }

    // The edge of each neighbour that touches this face, walked in the turn's rotational sense.
    static Strip[][] stripsArray = {
            { UR, UR, UR, UR },
            { DR, DR, DR, DR },
            { UR, RU, DR, LD },
            { DR, RD, UR, LU },
            { RD, LU, LU, RU },
            { LD, LU, RU, RU }
    };

    public Strip[] strips() {
        return stripsArray[ordinal()].clone();
    }

    // Starting corners of the clockwise walk around the face's own grid.
    static Strip[][] cornerWalkArray = {
            { UR, RD, DL, LU },
            { LD, DR, RU, UL }
    };

    public Strip[] cornerWalk() {
        return cornerWalkArray[parity() > 0 ? 0 : 1].clone();
    }

    private final char letter;
}
