package io.storylink.server;

import io.storylink.core.LinkPath;

import java.util.Arrays;

/**
 * Parsed request path of the story API.
 *
 * Layout:
 *   /stories/{story}/links
 *   /stories/{story}/links/{modulePath}/{link}/connections
 *   /stories/{story}/links/{modulePath}/{link}/connections/{id}
 *   /stories/{story}/links/{modulePath}/{link}/connections/{id}/{resource}
 *   /stories/{story}/links/{modulePath}/{link}/connections/{id}/watchers/{watcherId}
 *
 * {@code modulePath} is the module names joined with ':'. Fields that the
 * path does not reach are null.
 */
record LinkRoute(String storyId, LinkPath linkPath, Integer connectionId, String resource, Long watcherId) {

    static final String PREFIX = "/stories/";

    /**
     * @return the route, or null if {@code path} is not under the story API
     * @throws IllegalArgumentException if a segment is malformed
     */
    static LinkRoute parse(String path) {
        if (!path.startsWith(PREFIX)) {
            return null;
        }
        String[] seg = path.substring(1).split("/", -1);
        if (seg.length < 3 || !"links".equals(seg[2]) || seg.length == 4 || seg.length == 5) {
            return null;
        }
        String storyId = nonBlank(seg[1], "story id");
        if (seg.length == 3) {
            return new LinkRoute(storyId, null, null, null, null);
        }
        if (!"connections".equals(seg[5]) || seg.length > 9) {
            return null;
        }
        String modules = nonBlank(seg[3], "module path");
        LinkPath linkPath = new LinkPath(Arrays.asList(modules.split(":", -1)), nonBlank(seg[4], "link name"));
        if (seg.length == 6) {
            return new LinkRoute(storyId, linkPath, null, null, null);
        }
        int connectionId = parseInt(seg[6], "connection id");
        if (seg.length == 7) {
            return new LinkRoute(storyId, linkPath, connectionId, null, null);
        }
        String resource = nonBlank(seg[7], "resource");
        if (seg.length == 8) {
            return new LinkRoute(storyId, linkPath, connectionId, resource, null);
        }
        if (!"watchers".equals(resource)) {
            return null;
        }
        return new LinkRoute(storyId, linkPath, connectionId, resource, parseLong(seg[8], "watcher id"));
    }

    LinkService.SessionKey sessionKey() {
        return new LinkService.SessionKey(storyId, linkPath, connectionId);
    }

    private static String nonBlank(String s, String what) {
        if (s.isBlank()) {
            throw new IllegalArgumentException(what + " must not be empty");
        }
        return s;
    }

    private static int parseInt(String s, String what) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(what + " must be an integer", e);
        }
    }

    private static long parseLong(String s, String what) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(what + " must be an integer", e);
        }
    }
}
