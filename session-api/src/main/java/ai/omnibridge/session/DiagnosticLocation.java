package ai.omnibridge.session;

import java.util.Objects;

/**
 * A single analysis finding as reported by a session.
 *
 * <p>The orchestration core only groups by {@link #fileName()} and {@link #logLevel()}; the other
 * fields are carried through untouched.
 *
 * @param fileName file the finding is attached to
 * @param line 1-based line
 * @param column 1-based column
 * @param endLine 1-based end line
 * @param endColumn 1-based end column
 * @param text human readable message
 * @param logLevel category used for counting, e.g. {@code Error}, {@code Warning}, {@code Hidden}
 * @param id analyzer rule id, may be empty
 */
public record DiagnosticLocation(
        String fileName, int line, int column, int endLine, int endColumn, String text, String logLevel, String id) {

    public DiagnosticLocation {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(logLevel, "logLevel");
        text = text == null ? "" : text;
        id = id == null ? "" : id;
    }

    public static DiagnosticLocation of(String fileName, int line, int column, String text, String logLevel) {
        return new DiagnosticLocation(fileName, line, column, line, column, text, logLevel, "");
    }
}
