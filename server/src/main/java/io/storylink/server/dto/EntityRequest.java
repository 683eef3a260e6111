package io.storylink.server.dto;

public class EntityRequest {
    public String entityRef;
}
