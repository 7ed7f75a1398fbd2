package com.archivist.server.service.borgmatic;

import com.archivist.server.exception.JsonException;
import com.archivist.server.model.borgmatic.BorgArchive;
import com.archivist.server.model.borgmatic.ConfigValidationResult;
import com.archivist.server.model.borgmatic.RepositoryListing;
import com.archivist.server.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

public class BorgmaticParser {

    private static final String ALL_VALID_LINE = "All configuration files are valid";

    private static final String SUMMARY_LINE = "summary:";

    private static final List<String> WARNING_KEYWORDS = List.of("deprecated", "warning", "will be removed");

    private BorgmaticParser() {}

    /**
     * Parses {@code borgmatic list --json}. borgmatic prints one element per repository; a single
     * object is accepted as well.
     */
    public static List<RepositoryListing> parseListings(String stdout) throws JsonException {
        JsonNode root;
        try {
            root = JsonUtil.parseJsonTree(stdout);
        } catch (RuntimeException e) {
            throw new JsonException("parseListings failed. stdout is not json.", e);
        }
        List<RepositoryListing> result = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode element : root) {
                result.add(JsonUtil.convertNode(element, RepositoryListing.class));
            }
        } else if (root.isObject()) {
            result.add(JsonUtil.convertNode(root, RepositoryListing.class));
        } else {
            throw new JsonException("parseListings failed. unexpected json node type %s".formatted(
                    root.getNodeType()));
        }
        return result;
    }

    public static List<BorgArchive> flattenArchives(List<RepositoryListing> listings) {
        List<BorgArchive> result = new ArrayList<>();
        if (CollectionUtils.isEmpty(listings)) {
            return result;
        }
        for (RepositoryListing listing : listings) {
            if (CollectionUtils.isNotEmpty(listing.getArchives())) {
                result.addAll(listing.getArchives());
            }
        }
        return result;
    }

    // borg 的时间格式固定, 字符串比较即可
    public static String latestArchiveTime(List<BorgArchive> archives) {
        if (CollectionUtils.isEmpty(archives)) {
            return null;
        }
        return archives.stream()
                .map(BorgArchive::getCreatedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
    }

    /**
     * Sorts the output of {@code borgmatic config validate} into warnings and errors. The temporary
     * file path is replaced with "config.yaml" so it never reaches the caller.
     */
    public static ConfigValidationResult classifyValidationOutput(
            boolean success,
            String stdout,
            String stderr,
            String tempFilePath) {
        ConfigValidationResult result = new ConfigValidationResult();
        result.setValid(success);
        classifyLines(stderr, tempFilePath, result);
        classifyLines(stdout, tempFilePath, result);
        if (!success && CollectionUtils.isEmpty(result.getErrors())) {
            result.getErrors().add(StringUtils.isNotBlank(stderr) ?
                    StringUtils.replace(stderr.trim(), tempFilePath, "config.yaml") :
                    "Configuration validation failed");
        }
        return result;
    }

    private static void classifyLines(String output, String tempFilePath, ConfigValidationResult result) {
        if (StringUtils.isBlank(output)) {
            return;
        }
        for (String rawLine : output.split("\n")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.contains(ALL_VALID_LINE) || line.equals(SUMMARY_LINE)) {
                continue;
            }
            if (StringUtils.isNotEmpty(tempFilePath)) {
                line = StringUtils.replace(line, tempFilePath, "config.yaml");
            }
            String lower = line.toLowerCase();
            if (WARNING_KEYWORDS.stream().anyMatch(lower::contains)) {
                result.getWarnings().add(line);
            } else {
                result.getErrors().add(line);
            }
        }
    }
}
