package ai.omnibridge.context;

import static org.junit.jupiter.api.Assertions.*;

import ai.omnibridge.testutil.FakeHostDocument;
import ai.omnibridge.testutil.FakeSession;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

public class ActiveContextTrackerTest {
    private final VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
    private final ActiveContextTracker tracker = new ActiveContextTracker(scheduler, 100);
    private final FakeSession session = new FakeSession("S", "/repo");

    private TrackedDocument editor(String path) {
        return new TrackedDocument(FakeHostDocument.of(path), session, false);
    }

    private TrackedDocument config(String path) {
        return new TrackedDocument(FakeHostDocument.of(path), session, true);
    }

    private void advance(long millis) {
        scheduler.advanceTimeBy(Duration.ofMillis(millis));
    }

    @Test
    public void neverEmittedSource_leavesContextEmpty() {
        var seen = new ArrayList<Optional<TrackedDocument>>();
        tracker.activeContext().subscribe(seen::add);
        advance(1000);

        assertEquals(List.of(Optional.<TrackedDocument>empty()), seen);
        assertTrue(tracker.current().isEmpty());
    }

    @Test
    public void burstInsideWindow_commitsOnlyLastCandidate() {
        var d1 = editor("/repo/One.cs");
        var d2 = editor("/repo/Two.cs");
        var seen = new ArrayList<Optional<TrackedDocument>>();
        tracker.activeContext().subscribe(seen::add);

        tracker.submit(Optional.of(d1));
        advance(30);
        tracker.submit(Optional.of(d2));
        advance(100);

        assertEquals(List.of(Optional.empty(), Optional.of(d2)), seen);
        assertEquals(Optional.of(d2), tracker.current());
    }

    @Test
    public void commitWaitsForTheFullWindow() {
        var d1 = editor("/repo/One.cs");
        tracker.submit(Optional.of(d1));

        assertTrue(tracker.current().isEmpty());
        advance(99);
        assertTrue(tracker.current().isEmpty());
        advance(1);
        assertEquals(Optional.of(d1), tracker.current());
    }

    @Test
    public void facets_agreeAndAreDisjoint() {
        var plain = editor("/repo/One.cs");
        var project = config("/repo/project.json");
        var editors = new ArrayList<Optional<TrackedDocument>>();
        var configs = new ArrayList<Optional<TrackedDocument>>();
        var combined = new ArrayList<Optional<TrackedDocument>>();
        tracker.activeEditor().subscribe(editors::add);
        tracker.activeConfigEditor().subscribe(configs::add);
        tracker.activeContext().subscribe(combined::add);

        tracker.submit(Optional.of(plain));
        advance(100);
        tracker.submit(Optional.of(project));
        advance(100);
        tracker.submit(Optional.empty());
        advance(100);

        assertEquals(combined.size(), editors.size());
        assertEquals(combined.size(), configs.size());
        for (int i = 0; i < combined.size(); i++) {
            var e = editors.get(i);
            var c = configs.get(i);
            assertFalse(e.isPresent() && c.isPresent(), "both facets non-empty at step " + i);
            assertEquals(combined.get(i).isPresent(), e.isPresent() || c.isPresent());
        }
        assertEquals(Optional.of(plain), editors.get(1));
        assertEquals(Optional.of(project), configs.get(2));
    }

    @Test
    public void editorOnly_suppressesRepeatedEmptiesFromConfigChanges() {
        var plain = editor("/repo/One.cs");
        var firstConfig = config("/repo/a/project.json");
        var secondConfig = config("/repo/b/project.json");
        var editorOnly = new ArrayList<Optional<TrackedDocument>>();
        var editor = new ArrayList<Optional<TrackedDocument>>();
        tracker.activeEditorOnly().subscribe(editorOnly::add);
        tracker.activeEditor().subscribe(editor::add);

        for (var next : List.of(plain, firstConfig, secondConfig)) {
            tracker.submit(Optional.of(next));
            advance(100);
        }

        assertEquals(List.of(Optional.empty(), Optional.of(plain), Optional.empty()), editorOnly);
        assertEquals(4, editor.size(), "plain facet repeats the empty value");
    }

    @Test
    public void destroyedWhileQueued_isCommittedAsEmpty() {
        var host = FakeHostDocument.of("/repo/One.cs");
        var doc = new TrackedDocument(host, session, false);
        tracker.submit(Optional.of(doc));
        advance(50);

        host.destroy();
        advance(50);

        assertTrue(tracker.current().isEmpty());
    }

    @Test
    public void destroyingActiveDocument_clearsEveryFacetWithinOneWindow() {
        var host = FakeHostDocument.of("/repo/One.cs");
        var doc = new TrackedDocument(host, session, false);
        tracker.submit(Optional.of(doc));
        advance(100);
        assertEquals(Optional.of(doc), tracker.current());

        host.destroy();
        tracker.documentDestroyed(doc);
        advance(100);

        for (var facet : List.of(
                tracker.activeContext(),
                tracker.activeEditor(),
                tracker.activeConfigEditor(),
                tracker.activeEditorOnly())) {
            var latest = new ArrayList<Optional<TrackedDocument>>();
            facet.take(1).subscribe(latest::add);
            assertEquals(List.of(Optional.<TrackedDocument>empty()), latest);
        }
    }

    @Test
    public void destroyingOtherDocument_keepsContext() {
        var active = editor("/repo/One.cs");
        var other = editor("/repo/Two.cs");
        tracker.submit(Optional.of(active));
        advance(100);

        tracker.documentDestroyed(other);
        advance(100);

        assertEquals(Optional.of(active), tracker.current());
    }

    @Test
    public void close_commitsEmptyAndIgnoresLaterCandidates() {
        var doc = editor("/repo/One.cs");
        tracker.submit(Optional.of(doc));
        advance(100);
        var editors = new ArrayList<Optional<TrackedDocument>>();
        tracker.activeEditor().subscribe(editors::add);

        tracker.close();
        tracker.submit(Optional.of(doc));
        advance(100);

        assertTrue(tracker.current().isEmpty());
        assertEquals(List.of(Optional.of(doc), Optional.empty()), editors);
    }
}
