package com.archivist.server.service.borgmatic;

import com.archivist.server.exception.JsonException;
import com.archivist.server.model.borgmatic.BorgArchive;
import com.archivist.server.model.borgmatic.ConfigValidationResult;
import com.archivist.server.model.borgmatic.RepositoryListing;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BorgmaticParserTest {

    private static final String LIST_OUTPUT = """
            [{"archives": [
                {"archive": "host-2024-05-01T01:00:00", "name": "host-2024-05-01T01:00:00", "id": "a1",
                 "start": "2024-05-01T01:00:00.000000", "time": "2024-05-01T01:00:00.000000"},
                {"archive": "host-2024-05-02T01:00:00", "name": "host-2024-05-02T01:00:00", "id": "a2",
                 "start": "2024-05-02T01:00:00.000000", "time": "2024-05-02T01:00:00.000000"}],
              "encryption": {"mode": "repokey"},
              "repository": {"id": "r1", "last_modified": "2024-05-02T01:05:00.000000", "location": "/backups/repo"}}]
            """;

    @Test
    void parsesArrayOutput() {
        List<RepositoryListing> listings = BorgmaticParser.parseListings(LIST_OUTPUT);

        assertEquals(1, listings.size());
        assertEquals("/backups/repo", listings.get(0).getRepository().getLocation());
        List<BorgArchive> archives = BorgmaticParser.flattenArchives(listings);
        assertEquals(2, archives.size());
        assertEquals("2024-05-02T01:00:00.000000", BorgmaticParser.latestArchiveTime(archives));
    }

    @Test
    void parsesSingleObjectOutput() {
        List<RepositoryListing> listings = BorgmaticParser.parseListings("{\"archives\": []}");

        assertEquals(1, listings.size());
        assertTrue(BorgmaticParser.flattenArchives(listings).isEmpty());
        assertNull(BorgmaticParser.latestArchiveTime(List.of()));
    }

    @Test
    void rejectsNonJson() {
        assertThrows(JsonException.class, () -> BorgmaticParser.parseListings("borg: repository locked"));
        assertThrows(JsonException.class, () -> BorgmaticParser.parseListings(""));
        assertThrows(JsonException.class, () -> BorgmaticParser.parseListings("42"));
    }

    @Test
    void classifiesValidationOutput() {
        String tempPath = "/tmp/borgmatic-config-123.yaml";
        String stderr = """
                summary:
                %s: Error parsing configuration file
                %s: 'location' option is deprecated and will be removed
                """.formatted(tempPath, tempPath);

        ConfigValidationResult result = BorgmaticParser.classifyValidationOutput(
                false, "All configuration files are valid", stderr, tempPath);

        assertFalse(result.isValid());
        assertEquals(List.of("config.yaml: Error parsing configuration file"), result.getErrors());
        assertEquals(List.of("config.yaml: 'location' option is deprecated and will be removed"),
                result.getWarnings());
        assertEquals("config.yaml: Error parsing configuration file", result.getError());
    }

    @Test
    void failedValidationWithoutOutputGetsGenericError() {
        ConfigValidationResult result = BorgmaticParser.classifyValidationOutput(false, "", "", "/tmp/x.yaml");

        assertEquals(List.of("Configuration validation failed"), result.getErrors());
    }

    @Test
    void successfulValidationHasNoErrors() {
        ConfigValidationResult result = BorgmaticParser.classifyValidationOutput(
                true, "All configuration files are valid", "", "/tmp/x.yaml");

        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
        assertNull(result.getError());
    }
}
