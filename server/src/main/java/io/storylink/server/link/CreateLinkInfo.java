package io.storylink.server.link;

/**
 * Parameters for a link that may not exist yet.
 *
 * @param initialData JSON seed used when the link has no history, or null
 * @param permissions write policy, READ_WRITE when null
 */
public record CreateLinkInfo(String initialData, LinkPermissions permissions) {

    public CreateLinkInfo {
        if (permissions == null) {
            permissions = LinkPermissions.READ_WRITE;
        }
    }

    public static CreateLinkInfo withInitialData(String json) {
        return new CreateLinkInfo(json, LinkPermissions.READ_WRITE);
    }
}
