package com.csd.reqaudit.service;

import com.csd.reqaudit.exception.FetchException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads requirement files from a GitHub repository through the contents API.
 */
@Slf4j
@Service
public class GitHubRequirementsSource implements RequirementsSource {

    private static final Pattern URL_PATTERN =
            Pattern.compile("(?:https?://)?(?:([^@/]+)@)?github\\.com/([^/]+)/([^/]+?)(?:\\.git)?(?:/tree/([^/]+))?/?$");

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String apiUrl;
    private final String defaultToken;

    public GitHubRequirementsSource(OkHttpClient client,
                                    ObjectMapper mapper,
                                    @Value("${reqaudit.github.api-url:https://api.github.com}") String apiUrl,
                                    @Value("${reqaudit.github.token:}") String defaultToken) {
        this.client = client;
        this.mapper = mapper;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.defaultToken = defaultToken;
    }

    @Override
    public boolean supports(String location) {
        return location != null && URL_PATTERN.matcher(location.trim()).matches();
    }

    /** {@code owner/repo}, so same-named repositories of different owners stay apart. */
    @Override
    public String repoName(String location) {
        RepoCoordinates coordinates = coordinates(location);
        return coordinates.owner + "/" + coordinates.repo;
    }

    @Override
    public List<String> fetchRequirementLines(String location) throws FetchException {
        RepoCoordinates repo = coordinates(location);
        String token = repo.token != null ? repo.token : defaultToken;

        HttpUrl.Builder contentsUrl = HttpUrl.get(apiUrl).newBuilder()
                .addPathSegment("repos")
                .addPathSegment(repo.owner)
                .addPathSegment(repo.repo)
                .addPathSegment("contents")
                .addPathSegment("");
        if (repo.branch != null) {
            contentsUrl.addQueryParameter("ref", repo.branch);
        }

        log.info("Listing requirement files of {}/{}{}", repo.owner, repo.repo,
                repo.branch != null ? " @" + repo.branch : "");
        JsonNode listing = getJson(contentsUrl.build().toString(), token);
        List<String> fileUrls = searchRequirementsFiles(listing, token);
        log.info("Found {} requirement files in {}/{}", fileUrls.size(), repo.owner, repo.repo);

        List<String> lines = new ArrayList<>();
        for (String fileUrl : fileUrls) {
            lines.addAll(RequirementsSource.toLines(getBody(fileUrl, token)));
        }
        return lines;
    }

    /**
     * Picks the download URLs of requirement files from a directory listing, descending one
     * level into directories whose name contains {@code requirements}.
     */
    List<String> searchRequirementsFiles(JsonNode listing, String token) throws FetchException {
        if (listing == null || !listing.isArray()) {
            throw new FetchException("Invalid contents response: expected a JSON array");
        }
        List<String> files = new ArrayList<>();
        for (JsonNode entry : listing) {
            String name = entry.path("name").asText();
            String type = entry.path("type").asText();
            if (!RequirementsSource.isRequirementsName(name)) {
                continue;
            }
            if ("file".equals(type)) {
                addDownloadUrl(files, entry);
            } else if ("dir".equals(type)) {
                JsonNode dirListing = getJson(entry.path("url").asText(), token);
                if (!dirListing.isArray()) {
                    log.warn("Skipping directory {}: listing is not an array", name);
                    continue;
                }
                for (JsonNode dirEntry : dirListing) {
                    String dirEntryName = dirEntry.path("name").asText();
                    if ("file".equals(dirEntry.path("type").asText("file")) && dirEntryName.endsWith(".txt")) {
                        addDownloadUrl(files, dirEntry);
                    }
                }
            }
        }
        return files;
    }

    private void addDownloadUrl(List<String> files, JsonNode entry) {
        String downloadUrl = entry.path("download_url").asText(null);
        if (downloadUrl != null && !downloadUrl.isEmpty()) {
            files.add(downloadUrl);
        }
    }

    private JsonNode getJson(String url, String token) throws FetchException {
        String body = getBody(url, token);
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            throw new FetchException("Invalid JSON from " + url + ": " + e.getMessage(), e);
        }
    }

    private String getBody(String url, String token) throws FetchException {
        Request.Builder request = new Request.Builder().url(url);
        if (token != null && !token.isBlank()) {
            request.header("Authorization", "token " + token);
        }
        try (Response response = client.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new FetchException("GET " + url + " failed with HTTP " + response.code(), response.code());
            }
            ResponseBody body = response.body();
            return body != null ? body.string() : "";
        } catch (FetchException e) {
            throw e;
        } catch (IOException e) {
            throw new FetchException("GET " + url + " failed: " + e.getMessage(), e);
        }
    }

    static RepoCoordinates coordinates(String location) {
        Matcher m = URL_PATTERN.matcher(location == null ? "" : location.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a GitHub repository URL: " + location);
        }
        return new RepoCoordinates(m.group(1), m.group(2), m.group(3), m.group(4));
    }

    static final class RepoCoordinates {
        final String token;
        final String owner;
        final String repo;
        final String branch;

        RepoCoordinates(String token, String owner, String repo, String branch) {
            this.token = token;
            this.owner = owner;
            this.repo = repo;
            this.branch = branch;
        }
    }
}
