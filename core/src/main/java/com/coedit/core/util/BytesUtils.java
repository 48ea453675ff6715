package com.coedit.core.util;

import java.nio.charset.StandardCharsets;

public final class BytesUtils {
    private BytesUtils() {
    }

    /**
     * Size of a text frame on the wire, used for traffic metrics.
     */
    public static long utf8Length(String str) {
        return str == null ? 0 : str.getBytes(StandardCharsets.UTF_8).length;
    }
}
