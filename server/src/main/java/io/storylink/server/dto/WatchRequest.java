package io.storylink.server.dto;

/** JSON body for POST .../watchers; {@code all} also reports changes made through the same connection. */
public class WatchRequest {
    public boolean all;
}
