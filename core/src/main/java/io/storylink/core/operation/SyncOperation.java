package io.storylink.core.operation;

/**
 * Operation that completes as soon as it starts.
 * <p>
 * Because a queue runs operations strictly in order, the result of a
 * SyncOperation completes only after everything enqueued before it has
 * finished. Used as a drain checkpoint.
 */
public final class SyncOperation extends Operation<Void> {

    public SyncOperation() {
        super("SyncCall");
    }

    public SyncOperation(String traceName) {
        super(traceName);
    }

    @Override
    protected void run() {
        done(null);
    }
}
