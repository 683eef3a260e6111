package io.storylink.server.dto;

import java.util.List;

public class LinksResponse {
    public String storyId;
    public List<LinkRecord> links;

    public static class LinkRecord {
        public String modulePath; // module names joined with ':'
        public String linkName;
    }
}
