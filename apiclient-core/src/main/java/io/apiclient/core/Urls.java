package io.apiclient.core;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds request URLs with lexicographically sorted query parameter keys.
 */
public final class Urls {
    private Urls() {}

    public static String withQuery(String url, Map<String, String> params) {
        Objects.requireNonNull(url, "url");
        if (params == null || params.isEmpty()) return url;

        TreeMap<String, String> sorted = new TreeMap<>();
        params.forEach((key, value) -> {
            if (key != null && value != null) sorted.put(key, value);
        });
        if (sorted.isEmpty()) return url;

        StringBuilder sb = new StringBuilder(url);
        char separator = url.indexOf('?') < 0 ? '?' : '&';
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            sb.append(separator).append(encode(e.getKey())).append('=').append(encode(e.getValue()));
            separator = '&';
        }
        return sb.toString();
    }

    /**
     * Parses {@code url} as an absolute URI.
     *
     * @throws MalformedRequestException if the string is not a syntactically valid absolute URI
     */
    public static URI toAbsoluteUri(String url) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new MalformedRequestException("Invalid request URL [" + url + "]", e);
        }
        if (!uri.isAbsolute() || uri.getHost() == null) {
            throw new MalformedRequestException("Request URL [" + url + "] is not absolute");
        }
        return uri;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
