package io.storylink.storage;

/**
 * Receives every change written under a watched key prefix, including
 * changes written by the watching process itself.
 */
@FunctionalInterface
public interface PageWatcher {

    void onChange(PageEntry entry);
}
