package com.ai.codesearch.api;

import com.ai.codesearch.config.CodeSearchProperties;
import com.ai.codesearch.exception.UpstreamService;
import com.ai.codesearch.exception.UpstreamUnavailableException;
import com.ai.codesearch.model.ArchiveFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Downloads a repository ZIP for one version and unpacks it in memory.
 */
@Component
public class GithubArchiveClient {

    private static final Logger log = LoggerFactory.getLogger(GithubArchiveClient.class);

    private final RestTemplate rest;
    private final long maxArchiveBytes;

    public GithubArchiveClient(
            @Qualifier("archiveRestTemplate") RestTemplate rest,
            CodeSearchProperties properties) {
        this.rest = rest;
        this.maxArchiveBytes = properties.getGithub().getMaxArchiveBytes();
    }

    /**
     * @return every regular file of the archive with the top-level
     *         {@code <repo>-<ref>/} directory stripped from its path
     * @throws UpstreamUnavailableException if the archive cannot be downloaded or read
     */
    public List<ArchiveFile> download(String repoUrl, String version) {
        String url = GithubUrls.archiveUrl(repoUrl, version);
        log.info("[GithubArchiveClient] Downloading {}", url);

        List<ArchiveFile> files;
        try {
            files = rest.execute(url, HttpMethod.GET, null, response -> unzip(response.getBody()));
        } catch (RestClientException e) {
            log.error("[GithubArchiveClient] Failed to download {}: {}", url, e.getMessage());
            throw new UpstreamUnavailableException(UpstreamService.ARCHIVE,
                    "Failed to download repository archive " + url + ": " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            log.error("[GithubArchiveClient] Failed to read archive {}: {}", url, e.getMessage());
            throw new UpstreamUnavailableException(UpstreamService.ARCHIVE,
                    "Failed to read repository archive " + url + ": " + e.getMessage(), e);
        }

        if (files == null) {
            throw new UpstreamUnavailableException(UpstreamService.ARCHIVE, "Empty archive response for " + url);
        }
        log.info("[GithubArchiveClient] Unpacked {} files from {}", files.size(), url);
        return files;
    }

    List<ArchiveFile> unzip(InputStream body) throws IOException {
        List<ArchiveFile> files = new ArrayList<>();
        long totalBytes = 0;
        try (ZipInputStream zip = new ZipInputStream(body)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                String path = stripTopLevelDirectory(entry.getName());
                if (path.isEmpty()) {
                    continue;
                }
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                byte[] buffer = new byte[8192];
                int read;
                while ((read = zip.read(buffer)) != -1) {
                    totalBytes += read;
                    if (totalBytes > maxArchiveBytes) {
                        throw new UncheckedIOException(new IOException(
                                "Archive exceeds " + maxArchiveBytes + " bytes"));
                    }
                    out.write(buffer, 0, read);
                }
                files.add(new ArchiveFile(path, out.toByteArray()));
            }
        }
        return files;
    }

    static String stripTopLevelDirectory(String entryName) {
        int slash = entryName.indexOf('/');
        return slash >= 0 ? entryName.substring(slash + 1) : entryName;
    }
}
