package no.cantara.ucca.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;

/**
 * Lenient enum lookup: accepts the display label ("Cross-Controller"), the constant name
 * ("CROSS_CONTROLLER") or either form in any case with '-', '_' and spaces ignored.
 */
final class Labels {

    private Labels() {}

    static <E extends Enum<E>> E parse(Class<E> type, String value, Function<E, String> label) {
        if (value == null || value.isBlank()) return null;
        String wanted = normalise(value);
        return Arrays.stream(type.getEnumConstants())
                .filter(e -> normalise(label.apply(e)).equals(wanted) || normalise(e.name()).equals(wanted))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown " + type.getSimpleName() + " '" + value + "'"));
    }

    private static String normalise(String s) {
        return s.toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-]", "");
    }
}
