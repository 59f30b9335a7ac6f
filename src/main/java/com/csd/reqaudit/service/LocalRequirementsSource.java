package com.csd.reqaudit.service;

import com.csd.reqaudit.exception.FetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads requirement files from a checked-out project directory, given as an absolute path
 * or a {@code file:} URI.
 */
@Slf4j
@Service
public class LocalRequirementsSource implements RequirementsSource {

    @Override
    public boolean supports(String location) {
        if (location == null || location.isBlank()) return false;
        if (location.startsWith("file:")) return true;
        return !location.contains("://") && Path.of(location).isAbsolute();
    }

    @Override
    public String repoName(String location) {
        Path fileName = toPath(location).getFileName();
        return fileName != null ? fileName.toString() : location;
    }

    @Override
    public List<String> fetchRequirementLines(String location) throws FetchException {
        Path root = toPath(location);
        if (!Files.isDirectory(root)) {
            throw new FetchException("Not a directory: " + root);
        }
        List<String> lines = new ArrayList<>();
        for (Path file : searchRequirementsFiles(root)) {
            try {
                lines.addAll(RequirementsSource.toLines(Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                throw new FetchException("Failed to read " + file + ": " + e.getMessage(), e);
            }
        }
        return lines;
    }

    List<Path> searchRequirementsFiles(Path root) throws FetchException {
        List<Path> files = new ArrayList<>();
        for (Path entry : sortedChildren(root)) {
            String name = entry.getFileName().toString();
            if (!RequirementsSource.isRequirementsName(name)) {
                continue;
            }
            if (Files.isRegularFile(entry)) {
                files.add(entry);
            } else if (Files.isDirectory(entry)) {
                for (Path child : sortedChildren(entry)) {
                    if (Files.isRegularFile(child) && child.getFileName().toString().endsWith(".txt")) {
                        files.add(child);
                    }
                }
            }
        }
        log.debug("Requirement files under {}: {}", root, files);
        return files;
    }

    private static List<Path> sortedChildren(Path dir) throws FetchException {
        try (Stream<Path> children = Files.list(dir)) {
            return children.sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new FetchException("Failed to list " + dir + ": " + e.getMessage(), e);
        }
    }

    private static Path toPath(String location) {
        return location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    }
}
