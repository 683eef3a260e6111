package io.storylink.server.dto;

public class ConnectResponse {
    public int connectionId;
    public boolean primary;
}
