package com.tracelink.trace;

/**
 * Holds one {@link ContextStack} per thread. Request threads and the
 * background simulator thread each see their own stack, so spans opened in
 * one can never become current in another.
 */
public class ContextStorage {

    private final ThreadLocal<ContextStack> stacks = ThreadLocal.withInitial(ContextStack::new);

    /**
     * The stack of the calling thread, created on first use.
     */
    public ContextStack current() {
        return stacks.get();
    }

    /**
     * Drops the calling thread's stack once it is empty so pooled threads do
     * not pin it.
     */
    void releaseIfEmpty() {
        if (stacks.get().isEmpty()) {
            stacks.remove();
        }
    }
}
