package com.ai.codesearch.api;

import com.ai.codesearch.config.CodeSearchProperties;
import com.ai.codesearch.exception.UpstreamService;
import com.ai.codesearch.exception.UpstreamUnavailableException;
import com.ai.codesearch.model.ArchiveFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class GithubArchiveClientTest {

    private static final String REPO_URL = "https://github.com/modal-labs/modal-client";

    private MockRestServiceServer server;
    private CodeSearchProperties properties;
    private RestTemplate restTemplate;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new CodeSearchProperties();
    }

    private static byte[] zip(String... namesAndContents) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (int i = 0; i < namesAndContents.length; i += 2) {
                zip.putNextEntry(new ZipEntry(namesAndContents[i]));
                if (namesAndContents[i + 1] != null) {
                    zip.write(namesAndContents[i + 1].getBytes(StandardCharsets.UTF_8));
                }
                zip.closeEntry();
            }
        }
        return bytes.toByteArray();
    }

    @Test
    void testDownload_TagArchive_TopLevelDirectoryStripped() throws IOException {
        // Arrange
        byte[] archive = zip(
                "modal-client-1.0.3/", null,
                "modal-client-1.0.3/modal/", null,
                "modal-client-1.0.3/modal/app.py", "import modal\n",
                "modal-client-1.0.3/README.md", "# modal\n");
        server.expect(requestTo(REPO_URL + "/archive/refs/tags/v1.0.3.zip"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(archive, MediaType.APPLICATION_OCTET_STREAM));

        // Act
        List<ArchiveFile> files = new GithubArchiveClient(restTemplate, properties).download(REPO_URL, "v1.0.3");

        // Assert
        server.verify();
        assertEquals(List.of("modal/app.py", "README.md"), files.stream().map(ArchiveFile::path).toList());
        assertEquals("import modal\n", new String(files.get(0).content(), StandardCharsets.UTF_8));
    }

    @Test
    void testDownload_Latest_UsesMainBranch() throws IOException {
        // Arrange
        server.expect(requestTo(REPO_URL + "/archive/refs/heads/main.zip"))
                .andRespond(withSuccess(zip("modal-client-main/x.py", "x = 1\n"), MediaType.APPLICATION_OCTET_STREAM));

        // Act
        List<ArchiveFile> files = new GithubArchiveClient(restTemplate, properties).download(REPO_URL, "latest");

        // Assert
        assertEquals(1, files.size());
        assertEquals("x.py", files.get(0).path());
    }

    @Test
    void testDownload_UnknownTag_ArchiveUnavailable() {
        // Arrange
        server.expect(requestTo(REPO_URL + "/archive/refs/tags/v0.0.0.zip"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        GithubArchiveClient client = new GithubArchiveClient(restTemplate, properties);

        // Act & Assert
        UpstreamUnavailableException ex = assertThrows(UpstreamUnavailableException.class,
                () -> client.download(REPO_URL, "v0.0.0"));
        assertEquals(UpstreamService.ARCHIVE, ex.getService());
    }

    @Test
    void testDownload_ArchiveTooLarge_ArchiveUnavailable() throws IOException {
        // Arrange
        properties.getGithub().setMaxArchiveBytes(10);
        server.expect(requestTo(REPO_URL + "/archive/refs/tags/v1.zip"))
                .andRespond(withSuccess(zip("r-1/big.py", "x".repeat(100)), MediaType.APPLICATION_OCTET_STREAM));
        GithubArchiveClient client = new GithubArchiveClient(restTemplate, properties);

        // Act & Assert
        UpstreamUnavailableException ex = assertThrows(UpstreamUnavailableException.class,
                () -> client.download(REPO_URL, "v1"));
        assertEquals(UpstreamService.ARCHIVE, ex.getService());
    }

    @Test
    void testStripTopLevelDirectory() {
        assertEquals("src/a.py", GithubArchiveClient.stripTopLevelDirectory("repo-v1/src/a.py"));
        assertEquals("", GithubArchiveClient.stripTopLevelDirectory("repo-v1/"));
        assertEquals("loose.py", GithubArchiveClient.stripTopLevelDirectory("loose.py"));
    }
}
