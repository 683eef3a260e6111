package io.storylink.server.dto;

public class EntityResponse {
    public boolean found;
    public String entityRef;
}
