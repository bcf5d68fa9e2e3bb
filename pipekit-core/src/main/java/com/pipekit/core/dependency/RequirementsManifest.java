package com.pipekit.core.dependency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parser for the requirements manifest mapping a logical requirement to the artifacts
 * that provide it.
 *
 * <p>Used only to enrich remediation messages; resolution never depends on it.
 *
 * <p><b>Format:</b>
 * <pre>{@code
 * # com.fasterxml.jackson.databind.ObjectMapper
 * com.fasterxml.jackson.core:jackson-databind
 *
 * # org.apache.opennlp
 * org.apache.opennlp:opennlp-tools
 * org.apache.opennlp:opennlp-uima
 * }</pre>
 *
 * <p>A {@code #} line names a requirement; the following non-blank lines up to the next
 * header are its install names. Blank lines are ignored.
 */
public final class RequirementsManifest {

    private static final Logger log = LoggerFactory.getLogger(RequirementsManifest.class);
    private static final String HEADER_MARKER = "#";
    private static final Map<Path, Map<String, List<String>>> CACHE = new ConcurrentHashMap<>();

    private RequirementsManifest() {
        // Utility class
    }

    /**
     * Parses a manifest file.
     *
     * @param path manifest file
     * @return requirement name → install names, in file order
     * @throws ManifestReadException if the file is missing, unreadable or malformed
     */
    public static Map<String, List<String>> parse(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ManifestReadException(path, "file not found");
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(path);
        } catch (IOException e) {
            throw new ManifestReadException(path, e.getMessage(), e);
        }

        Map<String, List<String>> requirements = new LinkedHashMap<>();
        List<String> current = null;
        int lineNumber = 0;

        for (String raw : lines) {
            lineNumber++;
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(HEADER_MARKER)) {
                String name = line.substring(HEADER_MARKER.length()).strip();
                if (name.isEmpty()) {
                    throw new ManifestReadException(path, "empty requirement name at line " + lineNumber);
                }
                current = requirements.computeIfAbsent(name, key -> new ArrayList<>());
            } else if (current == null) {
                throw new ManifestReadException(path,
                    "install name '" + line + "' at line " + lineNumber + " precedes any requirement header");
            } else {
                current.add(line);
            }
        }

        Map<String, List<String>> result = new LinkedHashMap<>();
        requirements.forEach((name, installNames) -> result.put(name, List.copyOf(installNames)));
        log.debug("Parsed {} requirement groups from {}", result.size(), path);
        return Collections.unmodifiableMap(result);
    }

    /**
     * Parses a manifest once per process and returns the cached result afterwards.
     *
     * @param path manifest file
     * @return requirement name → install names
     * @throws ManifestReadException if the file is missing, unreadable or malformed
     */
    public static Map<String, List<String>> cached(Path path) {
        Path key = path.toAbsolutePath().normalize();
        Map<String, List<String>> parsed = CACHE.get(key);
        if (parsed == null) {
            parsed = parse(key);
            Map<String, List<String>> existing = CACHE.putIfAbsent(key, parsed);
            if (existing != null) {
                parsed = existing;
            }
        }
        return parsed;
    }

    /**
     * Looks up install names for the given requirements.
     *
     * @param manifest parsed manifest
     * @param requirementNames requirement names
     * @return requirement name → install names, only for names present in the manifest
     */
    public static Map<String, List<String>> installNamesFor(Map<String, List<String>> manifest,
                                                            Collection<String> requirementNames) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String name : requirementNames) {
            List<String> installNames = manifest.get(name);
            if (installNames != null) {
                result.put(name, installNames);
            }
        }
        return Collections.unmodifiableMap(result);
    }
}
