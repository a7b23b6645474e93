package com.ai.codesearch.api;

import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Pure URL transformations between repository, archive, blob and raw-content links.
 */
public final class GithubUrls {

    public static final String LATEST = "latest";
    public static final String DEFAULT_RAW_BASE_URL = "https://raw.githubusercontent.com";
    public static final String DEFAULT_BRANCH = "main";

    private static final String BLOB_SEGMENT = "blob";

    private GithubUrls() {
    }

    /**
     * Last path segment of the repository URL, e.g. {@code modal-client}.
     */
    public static String repoName(String repoUrl) {
        String trimmed = stripTrailingSlash(repoUrl.trim());
        if (trimmed.endsWith(".git")) {
            trimmed = trimmed.substring(0, trimmed.length() - 4);
        }
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    /**
     * Tag archive, or the main branch archive for {@code latest}.
     */
    public static String archiveUrl(String repoUrl, String version) {
        String base = stripTrailingSlash(repoUrl.trim());
        if (version == null || version.isBlank() || LATEST.equals(version)) {
            return base + "/archive/refs/heads/main.zip";
        }
        return base + "/archive/refs/tags/" + version + ".zip";
    }

    /**
     * Browsable link to a file. {@code latest} points at the main branch, the
     * archive it was indexed from. Path segments are percent-encoded.
     */
    public static String blobUrl(String repoUrl, String version, String path) {
        return stripTrailingSlash(repoUrl.trim()) + "/" + BLOB_SEGMENT + "/" + ref(version) + "/"
                + UriUtils.encodePath(path, StandardCharsets.UTF_8);
    }

    private static String ref(String version) {
        return (version == null || version.isBlank() || LATEST.equals(version)) ? DEFAULT_BRANCH : version;
    }

    /**
     * True for {@code <host>/<owner>/<repo>/blob/<version>/<path>} links.
     */
    public static boolean isBlobUrl(String url) {
        return blobParts(url) != null;
    }

    public static String toRawUrl(String blobUrl) {
        return toRawUrl(blobUrl, DEFAULT_RAW_BASE_URL);
    }

    /**
     * Rewrites {@code .../<owner>/<repo>/blob/<version>/<path>} to
     * {@code <rawBaseUrl>/<owner>/<repo>/refs/tags/<version>/<path>}, or to
     * {@code refs/heads/main} for the main branch. The path keeps its
     * percent-encoding. Anything else is returned unchanged.
     */
    public static String toRawUrl(String blobUrl, String rawBaseUrl) {
        List<String> parts = blobParts(blobUrl);
        if (parts == null) {
            return blobUrl;
        }
        int blobIndex = parts.indexOf(BLOB_SEGMENT);
        String owner = parts.get(blobIndex - 2);
        String repo = parts.get(blobIndex - 1);
        String version = parts.get(blobIndex + 1);
        String filePath = String.join("/", parts.subList(blobIndex + 2, parts.size()));
        String ref = DEFAULT_BRANCH.equals(version) || LATEST.equals(version)
                ? "refs/heads/" + DEFAULT_BRANCH
                : "refs/tags/" + version;
        return stripTrailingSlash(rawBaseUrl) + "/" + owner + "/" + repo + "/" + ref + "/" + filePath;
    }

    private static List<String> blobParts(String url) {
        if (url == null || !url.contains("/" + BLOB_SEGMENT + "/")) {
            return null;
        }
        String path;
        try {
            path = new URI(url).getRawPath();
        } catch (URISyntaxException e) {
            return null;
        }
        if (path == null) {
            return null;
        }
        List<String> parts = Arrays.stream(path.split("/"))
                .filter(part -> !part.isEmpty())
                .toList();
        int blobIndex = parts.indexOf(BLOB_SEGMENT);
        if (blobIndex < 2 || blobIndex + 2 >= parts.size()) {
            return null;
        }
        return parts;
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
