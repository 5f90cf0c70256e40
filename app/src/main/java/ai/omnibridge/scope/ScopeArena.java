package ai.omnibridge.scope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;
import reactor.core.Disposable;

/**
 * Table of live disposal scopes. A scope is a slot index plus the slot's generation at the time the
 * scope was opened; once released the generation moves on, so old handles become inert.
 *
 * <p>Scopes form a tree through explicit parent links. Releasing a scope runs its detach hook,
 * unlinks it from its parent, releases its children (newest first) and then disposes its resources
 * (newest first). A failing resource is logged and the rest are still disposed.
 */
@NullMarked
public final class ScopeArena {
    private static final Logger logger = LogManager.getLogger(ScopeArena.class);

    private record Ref(int index, int generation) {}

    private static final class Slot {
        int generation;
        boolean live;
        String label = "";
        int parent = -1;
        int parentGeneration;
        final List<Ref> children = new ArrayList<>();
        final List<Disposable> resources = new ArrayList<>();

        @Nullable
        Runnable detach;
    }

    // guarded by 'this'
    private final List<Slot> slots = new ArrayList<>();
    private final ArrayDeque<Integer> free = new ArrayDeque<>();

    /** Opens a scope with no parent. */
    public ScopeHandle openRoot(String label) {
        return open(null, label);
    }

    /**
     * Opens a child scope of {@code parent}.
     *
     * @throws IllegalStateException if the parent is already released
     */
    public synchronized ScopeHandle open(@Nullable ScopeHandle parent, String label) {
        if (parent != null && !isLive(parent)) {
            throw new IllegalStateException("Cannot open '" + label + "' under released scope " + parent);
        }
        int index;
        Slot slot;
        if (free.isEmpty()) {
            index = slots.size();
            slot = new Slot();
            slots.add(slot);
        } else {
            index = free.pop();
            slot = slots.get(index);
        }
        slot.live = true;
        slot.label = label;
        if (parent != null) {
            slot.parent = parent.index();
            slot.parentGeneration = parent.generation();
            slots.get(parent.index()).children.add(new Ref(index, slot.generation));
        } else {
            slot.parent = -1;
        }
        logger.trace("Opened scope {}#{} ({})", index, slot.generation, label);
        return new ScopeHandle(this, index, slot.generation, label);
    }

    synchronized boolean isLive(ScopeHandle handle) {
        var slot = slotFor(handle);
        return slot != null;
    }

    /** Adds a resource to the scope, or disposes it right away if the scope is already released. */
    void add(ScopeHandle handle, Disposable resource) {
        synchronized (this) {
            var slot = slotFor(handle);
            if (slot != null) {
                slot.resources.add(resource);
                return;
            }
        }
        disposeQuietly(resource, handle.label());
    }

    synchronized void setDetach(ScopeHandle handle, Runnable detach) {
        var slot = slotFor(handle);
        if (slot != null) {
            slot.detach = detach;
        }
    }

    void release(ScopeHandle handle) {
        release(handle.index(), handle.generation());
    }

    private void release(int index, int generation) {
        Runnable detach;
        List<Ref> children;
        List<Disposable> resources;
        String label;
        synchronized (this) {
            var slot = slots.get(index);
            if (!slot.live || slot.generation != generation) {
                return;
            }
            // dead from here on, so re-entrant releases are no-ops
            slot.live = false;
            slot.generation++;
            detach = slot.detach;
            slot.detach = null;
            children = new ArrayList<>(slot.children);
            slot.children.clear();
            resources = new ArrayList<>(slot.resources);
            slot.resources.clear();
            label = slot.label;

            if (slot.parent >= 0) {
                var parent = slots.get(slot.parent);
                if (parent.live && parent.generation == slot.parentGeneration) {
                    parent.children.remove(new Ref(index, generation));
                }
            }
        }

        if (detach != null) {
            try {
                detach.run();
            } catch (RuntimeException e) {
                logger.error("Detaching scope '{}' failed", label, e);
            }
        }
        for (int i = children.size() - 1; i >= 0; i--) {
            var child = children.get(i);
            release(child.index(), child.generation());
        }
        for (int i = resources.size() - 1; i >= 0; i--) {
            disposeQuietly(resources.get(i), label);
        }

        synchronized (this) {
            var slot = slots.get(index);
            slot.parent = -1;
            free.push(index);
        }
        logger.trace("Released scope {}#{} ({})", index, generation, label);
    }

    private static void disposeQuietly(Disposable resource, String label) {
        try {
            resource.dispose();
        } catch (RuntimeException e) {
            logger.error("Disposing a resource of scope '{}' failed", label, e);
        }
    }

    private @Nullable Slot slotFor(ScopeHandle handle) {
        if (handle.arena() != this || handle.index() >= slots.size()) {
            return null;
        }
        var slot = slots.get(handle.index());
        return slot.live && slot.generation == handle.generation() ? slot : null;
    }

    /** Number of scopes that are open right now. */
    public synchronized int liveCount() {
        int count = 0;
        for (var slot : slots) {
            if (slot.live) {
                count++;
            }
        }
        return count;
    }
}
