package io.storylink.server.dto;

import java.util.List;

/**
 * JSON body for PUT / PATCH / DELETE .../value.
 * Example:
 *   {
 *     "path": ["chapters", "0"],
 *     "json": "{\"title\":\"Intro\"}"
 *   }
 * A missing path addresses the root; json is ignored by DELETE.
 */
public class ValueRequest {
    public List<String> path;
    public String json;
}
