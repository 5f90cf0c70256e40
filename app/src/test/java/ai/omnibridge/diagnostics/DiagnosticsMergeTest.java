package ai.omnibridge.diagnostics;

import static org.junit.jupiter.api.Assertions.*;

import ai.omnibridge.session.DiagnosticLocation;
import ai.omnibridge.session.SessionValue;
import ai.omnibridge.testutil.FakeSession;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class DiagnosticsMergeTest {
    private final FakeSession a = new FakeSession("A", "/a");
    private final FakeSession b = new FakeSession("B", "/b");

    private final DiagnosticLocation errorInA = DiagnosticLocation.of("x.cs", 1, 1, "missing semicolon", "Error");
    private final DiagnosticLocation warningInB = DiagnosticLocation.of("x.cs", 2, 5, "unused variable", "Warning");

    @Test
    public void concat_keepsSessionOrderAndEveryEntry() {
        var merged = DiagnosticsMerge.concat(
                List.of(new SessionValue<>(a, List.of(errorInA)), new SessionValue<>(b, List.of(warningInB))));

        assertEquals(List.of(errorInA, warningInB), merged);
    }

    @Test
    public void sumCounts_addsCategoriesAcrossSessions() {
        var merged = DiagnosticsMerge.sumCounts(List.of(
                new SessionValue<>(a, Map.of("Error", 1, "Hidden", 3)),
                new SessionValue<>(b, Map.of("Warning", 1, "Hidden", 2))));

        assertEquals(Map.of("Error", 1, "Warning", 1, "Hidden", 5), merged);
    }

    @Test
    public void mergeByFile_laterSessionWinsForSameFile() {
        var other = DiagnosticLocation.of("y.cs", 3, 1, "obsolete", "Warning");
        var merged = DiagnosticsMerge.mergeByFile(List.of(
                new SessionValue<>(a, Map.of("x.cs", List.of(errorInA), "y.cs", List.of(other))),
                new SessionValue<>(b, Map.of("x.cs", List.of(warningInB)))));

        assertEquals(List.of(warningInB), merged.get("x.cs"));
        assertEquals(List.of(other), merged.get("y.cs"), "files only one session reports are kept");
    }

    @Test
    public void emptyInput_yieldsIdentityValues() {
        assertTrue(DiagnosticsMerge.concat(List.of()).isEmpty());
        assertTrue(DiagnosticsMerge.sumCounts(List.of()).isEmpty());
        assertTrue(DiagnosticsMerge.mergeByFile(List.of()).isEmpty());
    }
}
