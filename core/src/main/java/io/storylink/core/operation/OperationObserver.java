package io.storylink.core.operation;

/**
 * Hook invoked with an operation's trace name each time an {@link OperationQueue}
 * starts it. Tests use it to count which operations ran.
 */
@FunctionalInterface
public interface OperationObserver {

    OperationObserver NONE = traceName -> { };

    void started(String traceName);
}
