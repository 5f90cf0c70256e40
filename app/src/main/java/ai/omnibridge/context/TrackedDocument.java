package ai.omnibridge.context;

import ai.omnibridge.session.IHostDocument;
import ai.omnibridge.session.ISession;
import org.jetbrains.annotations.Nullable;

/**
 * A host document whose owning session is known. The session and the config flag are fixed when
 * the document is first tracked. Equality is identity.
 */
public final class TrackedDocument {
    private final IHostDocument host;
    private final ISession session;
    private final boolean config;

    TrackedDocument(IHostDocument host, ISession session, boolean config) {
        this.host = host;
        this.session = session;
        this.config = config;
    }

    public IHostDocument getHost() {
        return host;
    }

    public ISession getSession() {
        return session;
    }

    /** True for configuration documents (project files) as opposed to plain source editors. */
    public boolean isConfig() {
        return config;
    }

    public boolean isDestroyed() {
        return host.isDestroyed();
    }

    public @Nullable String getPath() {
        return host.getPath();
    }

    @Override
    public String toString() {
        return "TrackedDocument{" + "path=" + host.getPath() + ", config=" + config + ", session="
                + session.getName() + '}';
    }
}
