package no.cantara.ucca.constraint;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses free-text constraints into {@link ConstraintExpression}s.
 *
 * <p>Recognised forms (case-insensitive):
 * <pre>
 *   mode = approach          mode: approach        mode == approach
 *   time in 08:00-17:00      time: 22:00-06:00     between 08:00 and 17:00
 *   requires gear-armed      precondition: gear-armed
 * </pre>
 * Anything else becomes {@link ConstraintExpression.Unparsed}.
 */
public final class ConstraintParser {

    private static final Pattern MODE = Pattern.compile("(?i)^\\s*mode\\s*(?:==|=|:)\\s*(\\S.*?)\\s*$");
    private static final Pattern TIME = Pattern.compile(
            "(?i)^\\s*(?:time\\s*(?:in|:)\\s*(\\d{1,2}:\\d{2})\\s*-\\s*(\\d{1,2}:\\d{2})"
                    + "|between\\s+(\\d{1,2}:\\d{2})\\s+and\\s+(\\d{1,2}:\\d{2}))\\s*$");
    private static final Pattern PRECONDITION = Pattern.compile(
            "(?i)^\\s*(?:requires\\s+|precondition\\s*:\\s*)(\\S+)\\s*$");

    private ConstraintParser() {}

    public static ConstraintExpression parse(String text) {
        if (text == null) return new ConstraintExpression.Unparsed("");

        Matcher m = MODE.matcher(text);
        if (m.matches()) {
            return new ConstraintExpression.ModeEquals(m.group(1), text);
        }
        m = TIME.matcher(text);
        if (m.matches()) {
            String from = m.group(1) != null ? m.group(1) : m.group(3);
            String to = m.group(2) != null ? m.group(2) : m.group(4);
            try {
                return new ConstraintExpression.TimeWindow(parseTime(from), parseTime(to), text);
            } catch (DateTimeParseException e) {
                return new ConstraintExpression.Unparsed(text);
            }
        }
        m = PRECONDITION.matcher(text);
        if (m.matches()) {
            return new ConstraintExpression.PreconditionRef(m.group(1), text);
        }
        return new ConstraintExpression.Unparsed(text);
    }

    public static List<ConstraintExpression> parseAll(List<String> constraints) {
        return constraints.stream().map(ConstraintParser::parse).toList();
    }

    /** True if every constraint holds in {@code context}. An empty list always holds. */
    public static boolean allHold(List<String> constraints, ConstraintContext context) {
        if (constraints.isEmpty() || context.isUnconstrained()) return true;
        return parseAll(constraints).stream().allMatch(c -> c.holds(context));
    }

    static LocalTime parseTime(String hhmm) {
        // LocalTime.parse insists on two-digit hours
        return LocalTime.parse(hhmm.length() == 4 ? "0" + hhmm : hhmm);
    }
}
