package io.storylink.server.dto;

import java.util.List;

/** Values delivered to a watcher since the previous drain, oldest first. */
public class NotificationsResponse {
    public long watcherId;
    public List<String> values;
}
