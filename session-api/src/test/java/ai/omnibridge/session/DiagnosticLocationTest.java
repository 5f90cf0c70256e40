package ai.omnibridge.session;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class DiagnosticLocationTest {
    @Test
    public void of_usesStartAsEndAndEmptyId() {
        var location = DiagnosticLocation.of("/repo/x.cs", 3, 7, "missing semicolon", "Error");

        assertEquals(3, location.endLine());
        assertEquals(7, location.endColumn());
        assertEquals("", location.id());
    }

    @Test
    public void missingTextAndId_areNormalizedToEmpty() {
        var location = new DiagnosticLocation("/repo/x.cs", 1, 1, 1, 2, null, "Warning", null);

        assertEquals("", location.text());
        assertEquals("", location.id());
    }

    @Test
    public void fileNameAndLevel_areRequired() {
        assertThrows(NullPointerException.class, () -> DiagnosticLocation.of(null, 1, 1, "x", "Error"));
        assertThrows(NullPointerException.class, () -> DiagnosticLocation.of("/repo/x.cs", 1, 1, "x", null));
    }

    @Test
    public void offStates_areDisconnectedAndError() {
        assertTrue(ConnectionState.DISCONNECTED.isOff());
        assertTrue(ConnectionState.ERROR.isOff());
        assertFalse(ConnectionState.CONNECTING.isOff());
        assertFalse(ConnectionState.CONNECTED.isOff());
    }
}
