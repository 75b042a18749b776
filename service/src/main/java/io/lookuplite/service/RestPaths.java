package io.lookuplite.service;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * URI helpers shared by the REST clients.
 */
public final class RestPaths {

    private RestPaths() {
        // utility
    }

    /** Percent-encode one path segment ("a b" -> "a%20b", "a/b" -> "a%2Fb"). */
    public static String segment(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /** Form/query encoding for a single value. */
    public static String form(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    /**
     * Append an absolute path (and optional query) to a base URI, keeping any
     * path prefix the base already has.
     */
    public static URI join(URI base, String pathAndQuery) {
        Objects.requireNonNull(base, "base");
        String b = base.toString();
        if (b.endsWith("/")) {
            b = b.substring(0, b.length() - 1);
        }
        return URI.create(b + pathAndQuery);
    }
}
