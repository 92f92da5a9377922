package com.ivamare.retry.exception;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Walks the cause chain of an exception.
 *
 * <p>Used to decide whether a failure is, or wraps, a known error. Matching is done on
 * exception values (by {@code equals}) or on exception types, never on messages.
 *
 * <p>Cycles in the cause chain are tolerated: each exception is visited once.
 */
public final class ErrorChain {

    private ErrorChain() {
        // Utility class - no instantiation
    }

    /**
     * List the exception followed by each of its causes, outermost first.
     *
     * @param error the exception to unwrap, may be null
     * @return the chain, empty when error is null
     */
    public static List<Throwable> causes(Throwable error) {
        if (error == null) {
            return List.of();
        }

        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Throwable> chain = new ArrayList<>();
        Throwable current = error;
        while (current != null && seen.add(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return Collections.unmodifiableList(chain);
    }

    /**
     * Check whether the error, or any of its causes, equals the sentinel.
     *
     * @param error the exception to inspect
     * @param sentinel the value to look for
     * @return true if found
     */
    public static boolean contains(Throwable error, Throwable sentinel) {
        if (sentinel == null) {
            return false;
        }
        for (Throwable t : causes(error)) {
            if (t.equals(sentinel)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check whether the error, or any of its causes, equals one of the sentinels.
     *
     * @param error the exception to inspect
     * @param sentinels values to look for
     * @return true if any is found
     */
    public static boolean containsAny(Throwable error, Collection<? extends Throwable> sentinels) {
        if (sentinels.isEmpty()) {
            return false;
        }
        for (Throwable t : causes(error)) {
            if (sentinels.contains(t)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check whether the error, or any of its causes, is an instance of the given type.
     *
     * @param error the exception to inspect
     * @param type the exception type to look for
     * @return true if found
     */
    public static boolean containsInstanceOf(Throwable error, Class<? extends Throwable> type) {
        for (Throwable t : causes(error)) {
            if (type.isInstance(t)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check whether the error, or any of its causes, is an instance of one of the types.
     */
    public static boolean containsInstanceOfAny(Throwable error, Collection<Class<? extends Throwable>> types) {
        for (Class<? extends Throwable> type : types) {
            if (containsInstanceOf(error, type)) {
                return true;
            }
        }
        return false;
    }
}
