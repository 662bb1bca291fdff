package com.kickoff.tipping.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kickoff.tipping.service.source.SourcePull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/** Keeps the raw payloads of the latest full sync per season on disk for auditing. */
@Service
public class SyncArchiveService {
    private static final Logger log = LoggerFactory.getLogger(SyncArchiveService.class);

    static final String FILE_PREFIX = "nrl_season_";

    private final ObjectMapper objectMapper;
    private final Path archiveDir;

    public SyncArchiveService(ObjectMapper objectMapper,
                              @Value("${tipping.sync.archive-dir:data}") String archiveDir) {
        this.objectMapper = objectMapper;
        this.archiveDir = Paths.get(archiveDir);
    }

    /**
     * Overwrites {@code nrl_season_<year>.json}.
     * @return the written path, or null when the file could not be written
     */
    public Path write(int seasonYear, String sportKey, String downloadedAt, List<SourcePull> pulls, int mergedCount) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("downloaded_at", downloadedAt);
        root.put("season_year", seasonYear);
        root.put("sport_key", sportKey);
        ArrayNode sources = root.putArray("sources");
        for (SourcePull pull : pulls) {
            ObjectNode s = sources.addObject();
            s.put("source", pull.source());
            s.set("details", objectMapper.valueToTree(pull.details()));
            s.putArray("events").addAll(pull.events());
        }
        root.put("merged_fixture_count", mergedCount);

        Path target = archiveDir.resolve(FILE_PREFIX + seasonYear + ".json");
        try {
            Files.createDirectories(archiveDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), root);
            return target;
        } catch (IOException ex) {
            log.warn("[SYNC] could not write raw archive {}: {}", target, ex.getMessage());
            return null;
        }
    }
}
