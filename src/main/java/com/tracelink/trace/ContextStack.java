package com.tracelink.trace;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * LIFO chain of the spans open in one execution context. The top of the
 * stack is the current span. Not thread safe: a stack belongs to exactly one
 * thread, see {@link ContextStorage}.
 */
public final class ContextStack {

    private final Deque<Span> spans = new ArrayDeque<>();

    public Optional<Span> current() {
        return Optional.ofNullable(spans.peek());
    }

    public int depth() {
        return spans.size();
    }

    public boolean isEmpty() {
        return spans.isEmpty();
    }

    public boolean contains(Span span) {
        return spans.contains(span);
    }

    boolean isTop(Span span) {
        return spans.peek() == span;
    }

    void push(Span span) {
        spans.push(span);
    }

    Span pop() {
        return spans.pop();
    }

    /**
     * Pops the top span only if it is the given one.
     */
    boolean popIfTop(Span span) {
        if (!isTop(span)) {
            return false;
        }
        spans.pop();
        return true;
    }
}
