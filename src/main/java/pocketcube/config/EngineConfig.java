package pocketcube.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import pocketcube.Color;
import pocketcube.ColorScheme;
import pocketcube.Face;
import pocketcube.scramble.Scrambler;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Engine settings, bound from JSON. Defaults live in the field initialisers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    public int scrambleLength = Scrambler.DEFAULT_LENGTH;
    public Long scrambleSeed = null;
    public Map<String, String> colorScheme = defaultColorScheme();

    /**
     * Checks the values and resolves the colour scheme.
     */
    public void validate() {
        if (scrambleLength < 0)
            throw new ConfigException("scrambleLength must not be negative, got " + scrambleLength);
        toColorScheme();
    }

    public ColorScheme toColorScheme() {
        if (colorScheme == null)
            throw new ConfigException("colorScheme must not be null");

        Map<Face, Color> colors = new EnumMap<>(Face.class);
        for (Map.Entry<String, String> entry: colorScheme.entrySet()) {
            Face face = parseEnum(Face.class, entry.getKey(), "face");
            Color color = parseEnum(Color.class, entry.getValue(), "colour");
            colors.put(face, color);
        }
        try {
            return ColorScheme.of(colors);
        }
        catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid colorScheme: " + e.getMessage(), e);
        }
    }

    public Scrambler newScrambler() {
        return new Scrambler(scrambleLength, scrambleSeed);
    }

    static Map<String, String> defaultColorScheme() {
        Map<String, String> scheme = new LinkedHashMap<>();
        for (Map.Entry<Face, Color> entry: ColorScheme.defaults().asMap().entrySet()) {
            scheme.put(entry.getKey().name(), entry.getValue().name());
        }
        return scheme;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String what) {
        if (value == null)
            throw new ConfigException("Missing " + what + " in colorScheme");
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            throw new ConfigException("Unknown " + what + " '" + value + "' in colorScheme", e);
        }
    }
}
