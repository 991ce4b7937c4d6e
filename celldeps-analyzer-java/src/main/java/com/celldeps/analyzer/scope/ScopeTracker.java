package com.celldeps.analyzer.scope;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Stack of lexical frames for one analysis run, plus the cell's flat write set.
 *
 * <p>The bottom frame is the cell itself. Each nested function, lambda, class or
 * comprehension pushes an owned copy of the frame below it with the construct's
 * own names seeded in, so names bound inside never leak back out when it is
 * popped. Every bound name, at any depth, is also recorded in {@link #writes()}.</p>
 *
 * <p>Comprehension frames are marked: an assignment expression inside a
 * comprehension binds in the nearest enclosing frame that is not one.</p>
 *
 * <p>Not thread-safe; one instance per analysis.</p>
 */
public class ScopeTracker {

    private final Deque<Level> frames = new ArrayDeque<>();
    private final Set<String> writes = new LinkedHashSet<>();

    public ScopeTracker() {
        frames.push(new Level(new HashSet<>(), false));
    }

    /**
     * Pushes a frame holding everything visible in the current frame plus {@code seed}.
     * Close the returned frame to pop it:
     *
     * <pre>{@code
     * try (ScopeTracker.Frame ignored = tracker.enter(parameterNames)) {
     *     walk(body);
     * }
     * }</pre>
     */
    public Frame enter(Collection<String> seed) {
        return push(seed, false);
    }

    /** Pushes a comprehension frame; see {@link #bindEnclosing(String)}. */
    public Frame enterComprehension() {
        return push(List.of(), true);
    }

    /** True iff {@code name} is bound in the innermost frame. */
    public boolean isLocallyBound(String name) {
        return frames.peek().names().contains(name);
    }

    /** Binds {@code name} in the innermost frame and records it as a write of the cell. */
    public void bind(String name) {
        frames.peek().names().add(name);
        writes.add(name);
    }

    /**
     * Binds {@code name} in the nearest frame that is not a comprehension, and in every
     * comprehension frame above it so the rest of the comprehension sees it too.
     */
    public void bindEnclosing(String name) {
        for (Level level : frames) {
            level.names().add(name);
            if (!level.comprehension()) {
                break;
            }
        }
        writes.add(name);
    }

    public int depth() {
        return frames.size();
    }

    /** Every name bound so far, in first-binding order. */
    public Set<String> writes() {
        return Collections.unmodifiableSet(writes);
    }

    private Frame push(Collection<String> seed, boolean comprehension) {
        Set<String> names = new HashSet<>(frames.peek().names());
        names.addAll(seed);
        Level level = new Level(names, comprehension);
        frames.push(level);
        return new Frame(level);
    }

    private void pop(Level expected) {
        if (frames.size() == 1) {
            throw new IllegalStateException("Cannot leave the cell frame");
        }
        if (frames.peek() != expected) {
            throw new IllegalStateException("Frames must be left in the reverse order they were entered");
        }
        frames.pop();
    }

    /**
     * Handle for a pushed frame. Closing it twice is a no-op.
     */
    public final class Frame implements AutoCloseable {

        private final Level level;
        private boolean closed;

        private Frame(Level level) {
            this.level = level;
        }

        @Override
        public void close() {
            if (closed) return;
            pop(level);
            closed = true;
        }
    }

    private record Level(Set<String> names, boolean comprehension) {}
}
