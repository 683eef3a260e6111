package io.storylink.storage;

/** Handle returned by {@link PageStore#watch}; closing it stops further notifications. */
public interface PageSubscription extends AutoCloseable {

    @Override
    void close();
}
