package io.storylink.server.dto;

/**
 * JSON body for POST .../connections.
 * Example:
 *   {
 *     "primary": true,
 *     "initialData": "{\"title\":\"\"}",
 *     "permissions": "READ_ONLY_FOR_OTHERS"
 *   }
 * Every field is optional.
 */
public class ConnectRequest {
    public boolean primary;
    public String initialData; // JSON text seeded into a brand new link
    public String permissions; // READ_WRITE (default) or READ_ONLY_FOR_OTHERS
}
