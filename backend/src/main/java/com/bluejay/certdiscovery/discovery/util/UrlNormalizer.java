package com.bluejay.certdiscovery.discovery.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Dedup keys for discovered URLs: scheme and host lower-cased, path kept, query and fragment dropped,
 * trailing slash ignored.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    public static String normalize(String candidate) {
        return normalize(candidate, null);
    }

    /**
     * Resolves {@code candidate} against {@code root} when it is relative. Returns null for anything
     * that is not an absolute http(s) URL with a host.
     */
    public static String normalize(String candidate, String root) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        URI uri = safeUri(candidate.trim().replace(" ", "%20"));
        if (uri == null) {
            return null;
        }
        if (!uri.isAbsolute()) {
            URI base = root == null ? null : safeUri(root.trim());
            if (base == null || !base.isAbsolute()) {
                return null;
            }
            try {
                uri = base.resolve(uri);
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return null;
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return null;
        }
        StringBuilder out = new StringBuilder();
        out.append(scheme).append("://").append(host.toLowerCase(Locale.ROOT));
        if (uri.getPort() > 0 && !isDefaultPort(scheme, uri.getPort())) {
            out.append(':').append(uri.getPort());
        }
        String path = uri.getRawPath();
        if (path != null && !path.isEmpty()) {
            while (path.length() > 1 && path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            if (!"/".equals(path)) {
                out.append(path);
            }
        }
        return out.toString();
    }

    public static boolean isHttpUrl(String candidate) {
        return normalize(candidate) != null;
    }

    public static boolean isHttps(String candidate) {
        URI uri = candidate == null ? null : safeUri(candidate.trim());
        return uri != null && "https".equalsIgnoreCase(uri.getScheme());
    }

    public static String host(String candidate) {
        URI uri = candidate == null ? null : safeUri(candidate.trim());
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    public static String path(String candidate) {
        URI uri = candidate == null ? null : safeUri(candidate.trim());
        if (uri == null || uri.getPath() == null) {
            return "";
        }
        return uri.getPath();
    }

    public static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }
}
