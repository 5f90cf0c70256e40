package ai.omnibridge.diagnostics;

import ai.omnibridge.session.DiagnosticLocation;
import ai.omnibridge.session.SessionValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.NullMarked;

/** Combines per-session diagnostics into one cross-session value. Input order is registry order. */
@NullMarked
public final class DiagnosticsMerge {
    private DiagnosticsMerge() {}

    /** All findings, session by session, each session's findings in its own order. */
    public static List<DiagnosticLocation> concat(List<SessionValue<List<DiagnosticLocation>>> perSession) {
        var result = new ArrayList<DiagnosticLocation>();
        for (var value : perSession) {
            result.addAll(value.value());
        }
        return Collections.unmodifiableList(result);
    }

    public static Map<String, Integer> sumCounts(List<SessionValue<Map<String, Integer>>> perSession) {
        var result = new LinkedHashMap<String, Integer>();
        for (var value : perSession) {
            value.value().forEach((category, count) -> result.merge(category, count, Integer::sum));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Merges the file maps. When two sessions report the same file, the later session's entries
     * replace the earlier ones; the flat list from {@link #concat} keeps both.
     */
    public static Map<String, List<DiagnosticLocation>> mergeByFile(
            List<SessionValue<Map<String, List<DiagnosticLocation>>>> perSession) {
        var result = new LinkedHashMap<String, List<DiagnosticLocation>>();
        for (var value : perSession) {
            result.putAll(value.value());
        }
        return Collections.unmodifiableMap(result);
    }
}
