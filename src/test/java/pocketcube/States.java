package pocketcube;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;

class States {
    // Random colours on every facelet. Most of these states are unreachable, which is fine:
    // the move laws hold for any assignment.
    static CubeState random(Random random) {
        Color[] colors = Color.values();
        Map<FaceletAddress, Color> assignment = new HashMap<>();
        for (FaceletAddress address: FaceletAddress.all()) {
            assignment.put(address, colors[random.nextInt(colors.length)]);
        }
        return CubeState.of(assignment);
    }

    static CubeState parse(String codes) {
        Map<FaceletAddress, Color> assignment = new HashMap<>();
        for (FaceletAddress address: FaceletAddress.all()) {
            char code = codes.charAt(address.index());
            for (Color color: Color.values()) {
                if (color.code() == code)
                    assignment.put(address, color);
            }
        }
        return CubeState.of(assignment);
    }
}
