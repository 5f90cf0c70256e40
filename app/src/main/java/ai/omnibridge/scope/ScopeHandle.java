package ai.omnibridge.scope;

import reactor.core.Disposable;

/**
 * Handle to one scope in a {@link ScopeArena}. Resources added here are disposed when the scope is
 * released. A handle whose scope was released is inert: {@link #add} disposes immediately and
 * {@link #dispose} does nothing.
 */
public final class ScopeHandle implements Disposable {
    private final ScopeArena arena;
    private final int index;
    private final int generation;
    private final String label;

    ScopeHandle(ScopeArena arena, int index, int generation, String label) {
        this.arena = arena;
        this.index = index;
        this.generation = generation;
        this.label = label;
    }

    public void add(Disposable resource) {
        arena.add(this, resource);
    }

    /** Opens a nested scope released together with this one. */
    public ScopeHandle openChild(String childLabel) {
        return arena.open(this, childLabel);
    }

    @Override
    public boolean isDisposed() {
        return !arena.isLive(this);
    }

    @Override
    public void dispose() {
        arena.release(this);
    }

    /** Runs first on release, before the scope is unlinked from its parent. */
    void onDetach(Runnable detach) {
        arena.setDetach(this, detach);
    }

    ScopeArena arena() {
        return arena;
    }

    int index() {
        return index;
    }

    int generation() {
        return generation;
    }

    String label() {
        return label;
    }

    @Override
    public String toString() {
        return "ScopeHandle{" + label + " " + index + "#" + generation + '}';
    }
}
