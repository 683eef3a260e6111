package io.storylink.server.dto;

public class ValueResponse {
    public boolean found;
    public String json; // null when nothing is stored at the path
}
