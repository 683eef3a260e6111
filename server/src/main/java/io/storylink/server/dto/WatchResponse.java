package io.storylink.server.dto;

public class WatchResponse {
    public long watcherId;
}
