package com.bko.servicedesk.tools;

import org.springframework.lang.Nullable;

/**
 * Reply shape of every customer service tool callback: either {@code data} or {@code error} is set.
 */
public record ToolReply(boolean success, @Nullable Object data, @Nullable String error) {

    public static ToolReply ok(Object data) {
        return new ToolReply(true, data, null);
    }

    public static ToolReply failed(String error) {
        return new ToolReply(false, null, error);
    }
}
