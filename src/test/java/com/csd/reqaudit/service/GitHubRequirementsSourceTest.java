package com.csd.reqaudit.service;

import com.csd.reqaudit.exception.FetchException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

class GitHubRequirementsSourceTest {

    private MockWebServer webServer;
    private GitHubRequirementsSource source;
    private final Map<String, MockResponse> routes = new HashMap<>();

    @BeforeEach
    void setup() throws IOException {
        webServer = new MockWebServer();
        webServer.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getRequestUrl().encodedPath();
                return routes.getOrDefault(path, new MockResponse().setResponseCode(404).setBody("not found"));
            }
        });
        webServer.start();
        source = new GitHubRequirementsSource(new OkHttpClient(), new ObjectMapper(), webServer.url("/").toString(), "");
    }

    @AfterEach
    void tearDown() throws IOException {
        webServer.shutdown();
    }

    private String url(String path) {
        return webServer.url(path).toString();
    }

    private void route(String path, String body) {
        routes.put(path, new MockResponse().setResponseCode(200)
                .addHeader("Content-Type", "application/json; charset=utf-8")
                .setBody(body));
    }

    @Test
    void collectsRequirementFilesAndOneLevelOfDirectories() throws Exception {
        route("/repos/octo/app/contents/", "["
                + "{\"name\":\"README.md\",\"type\":\"file\",\"download_url\":\"" + url("/raw/README.md") + "\"},"
                + "{\"name\":\"requirements.txt\",\"type\":\"file\",\"download_url\":\"" + url("/raw/requirements.txt") + "\"},"
                + "{\"name\":\"requirements\",\"type\":\"dir\",\"url\":\"" + url("/repos/octo/app/contents/requirements") + "\"},"
                + "{\"name\":\"src\",\"type\":\"dir\",\"url\":\"" + url("/repos/octo/app/contents/src") + "\"}"
                + "]");
        route("/repos/octo/app/contents/requirements", "["
                + "{\"name\":\"dev.txt\",\"type\":\"file\",\"download_url\":\"" + url("/raw/requirements/dev.txt") + "\"},"
                + "{\"name\":\"notes.md\",\"type\":\"file\",\"download_url\":\"" + url("/raw/requirements/notes.md") + "\"}"
                + "]");
        route("/raw/requirements.txt", "Django==1.11.0\r\n\r\nrequests\n");
        route("/raw/requirements/dev.txt", "pytest>=3.0\n\n");

        List<String> lines = source.fetchRequirementLines("https://github.com/octo/app");

        assertEquals(List.of("Django==1.11.0", "requests", "pytest>=3.0"), lines);
        assertEquals(4, webServer.getRequestCount());
    }

    @Test
    void branchAndEmbeddedTokenAreSent() throws Exception {
        route("/repos/octo/app/contents/", "[]");

        assertTrue(source.fetchRequirementLines("https://s3cr3t@github.com/octo/app.git/tree/release").isEmpty());

        RecordedRequest request = webServer.takeRequest();
        assertEquals("release", request.getRequestUrl().queryParameter("ref"));
        assertEquals("token s3cr3t", request.getHeader("Authorization"));
    }

    @Test
    void httpErrorsSurfaceAsFetchException() {
        FetchException e = assertThrows(FetchException.class,
                () -> source.fetchRequirementLines("https://github.com/octo/missing"));
        assertEquals(404, e.getStatusCode());
    }

    @Test
    void nonArrayListingIsRejected() {
        route("/repos/octo/app/contents/", "{\"message\":\"This repository is empty.\"}");
        assertThrows(FetchException.class, () -> source.fetchRequirementLines("github.com/octo/app"));
    }

    @Test
    void recognisesGitHubLocations() {
        assertTrue(source.supports("https://github.com/PyGithub/PyGithub"));
        assertTrue(source.supports("github.com/PyGithub/PyGithub/"));
        assertTrue(source.supports("https://token@github.com/PyGithub/PyGithub.git"));
        assertFalse(source.supports("https://gitlab.com/group/project"));
        assertFalse(source.supports("/home/me/project"));

        assertEquals("PyGithub/PyGithub", source.repoName("https://github.com/PyGithub/PyGithub/tree/main"));
        assertEquals("PyGithub/PyGithub", source.repoName("https://github.com/PyGithub/PyGithub.git"));
        assertNotEquals(source.repoName("https://github.com/a/utils"), source.repoName("https://github.com/b/utils"));
    }
}
