package ai.omnibridge.session;

import org.jetbrains.annotations.Nullable;
import reactor.core.Disposable;

/**
 * An open document as the host editor reports it. Identity is object identity: unsaved documents
 * have no path yet.
 */
public interface IHostDocument {
    /** Absolute path, or null while the document has never been saved. */
    @Nullable
    String getPath();

    /** Language / grammar identifier the host assigned, e.g. {@code csharp}. */
    String getLanguageId();

    boolean isDestroyed();

    /** Invoked once when the host destroys the document. */
    Disposable onDidDestroy(Runnable callback);

    /** Invoked whenever the document's path is assigned or changes (e.g. first save). */
    Disposable onDidChangePath(Runnable callback);
}
