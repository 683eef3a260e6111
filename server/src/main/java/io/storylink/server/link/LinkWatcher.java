package io.storylink.server.link;

/** Receives the full JSON value of a link after each change. */
@FunctionalInterface
public interface LinkWatcher {

    void notify(String json);
}
