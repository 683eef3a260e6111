package io.storylink.core.operation;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Adapts an asynchronous step into an {@link Operation}: the supplier is invoked
 * when the operation starts, and the operation completes when the returned
 * stage does.
 */
public final class FutureOperation<T> extends Operation<T> {
    private final Supplier<? extends CompletionStage<T>> body;

    public FutureOperation(String traceName, Supplier<? extends CompletionStage<T>> body) {
        super(traceName);
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    protected void run() {
        CompletionStage<T> stage = body.get();
        if (stage == null) {
            done(null);
            return;
        }
        stage.whenComplete((value, error) -> {
            if (error != null) {
                fail(error);
            } else {
                done(value);
            }
        });
    }
}
