package com.ai.codesearch.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GithubUrlsTest {

    @Test
    void testToRawUrl_BlobUrl_Rewritten() {
        String blob = "https://github.com/modal-labs/modal-client/blob/v0.77.0/conftest.py";

        assertEquals("https://raw.githubusercontent.com/modal-labs/modal-client/refs/tags/v0.77.0/conftest.py",
                GithubUrls.toRawUrl(blob));
    }

    @Test
    void testToRawUrl_NestedPath_KeepsAllSegments() {
        String blob = "https://github.com/modal-labs/modal-client/blob/v1.0.3/modal/_utils/async_utils.py";

        assertEquals(
                "https://raw.githubusercontent.com/modal-labs/modal-client/refs/tags/v1.0.3/modal/_utils/async_utils.py",
                GithubUrls.toRawUrl(blob));
    }

    @Test
    void testToRawUrl_CustomRawHost() {
        assertEquals("http://localhost:9000/o/r/refs/tags/v1/a.py",
                GithubUrls.toRawUrl("https://github.com/o/r/blob/v1/a.py", "http://localhost:9000/"));
    }

    @Test
    void testToRawUrl_NonBlobUrl_Unchanged() {
        String tree = "https://github.com/modal-labs/modal-client/tree/main";

        assertEquals(tree, GithubUrls.toRawUrl(tree));
        assertFalse(GithubUrls.isBlobUrl(tree));
        assertFalse(GithubUrls.isBlobUrl(""));
        assertFalse(GithubUrls.isBlobUrl(null));
        assertFalse(GithubUrls.isBlobUrl("https://github.com/o/r/blob/v1"));
    }

    @Test
    void testRepoName_LastSegment() {
        assertEquals("modal-client", GithubUrls.repoName("https://github.com/modal-labs/modal-client"));
        assertEquals("modal-client", GithubUrls.repoName("https://github.com/modal-labs/modal-client/"));
        assertEquals("modal-client", GithubUrls.repoName("https://github.com/modal-labs/modal-client.git"));
    }

    @Test
    void testArchiveUrl_TagAndLatest() {
        assertEquals("https://github.com/o/r/archive/refs/tags/v1.0.3.zip",
                GithubUrls.archiveUrl("https://github.com/o/r", "v1.0.3"));
        assertEquals("https://github.com/o/r/archive/refs/heads/main.zip",
                GithubUrls.archiveUrl("https://github.com/o/r/", "latest"));
    }

    @Test
    void testBlobUrl_RoundTripsThroughRawRewrite() {
        String blob = GithubUrls.blobUrl("https://github.com/o/r", "v2", "src/main.go");

        assertEquals("https://github.com/o/r/blob/v2/src/main.go", blob);
        assertTrue(GithubUrls.isBlobUrl(blob));
    }

    @Test
    void testBlobUrl_PathWithSpaces_PercentEncoded() {
        String blob = GithubUrls.blobUrl("https://github.com/o/r", "v2", "docs/my file#1.py");

        assertEquals("https://github.com/o/r/blob/v2/docs/my%20file%231.py", blob);
        assertTrue(GithubUrls.isBlobUrl(blob));
        assertEquals("https://raw.githubusercontent.com/o/r/refs/tags/v2/docs/my%20file%231.py",
                GithubUrls.toRawUrl(blob));
    }

    @Test
    void testBlobUrl_Latest_PointsAtMainBranch() {
        String blob = GithubUrls.blobUrl("https://github.com/o/r", "latest", "a.py");

        assertEquals("https://github.com/o/r/blob/main/a.py", blob);
        assertEquals("https://raw.githubusercontent.com/o/r/refs/heads/main/a.py", GithubUrls.toRawUrl(blob));
        assertEquals("https://raw.githubusercontent.com/o/r/refs/heads/main/a.py",
                GithubUrls.toRawUrl("https://github.com/o/r/blob/latest/a.py"));
    }
}
