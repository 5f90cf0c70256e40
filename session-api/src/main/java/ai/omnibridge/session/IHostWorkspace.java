package ai.omnibridge.session;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import reactor.core.Disposable;

/** The host editor's pane and document lifecycle notifications. */
public interface IHostWorkspace {
    /**
     * Invokes the callback for every document already open and for every document opened later.
     */
    Disposable observeDocuments(Consumer<IHostDocument> callback);

    /**
     * Invokes the callback with the current active pane item immediately and on every change. Pane
     * items that are not documents are reported as empty.
     */
    Disposable observeActivePaneItem(Consumer<Optional<IHostDocument>> callback);

    List<IHostDocument> getDocuments();
}
