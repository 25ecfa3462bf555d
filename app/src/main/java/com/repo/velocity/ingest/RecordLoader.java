package com.repo.velocity.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repo.velocity.core.AnalysisWarning;
import com.repo.velocity.core.CiStatus;
import com.repo.velocity.core.CommitRecord;
import com.repo.velocity.core.DeploymentRecord;
import com.repo.velocity.core.DeploymentStatus;
import com.repo.velocity.core.IncidentRecord;
import com.repo.velocity.core.MalformedRecordException;
import com.repo.velocity.core.PullRequestRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Reads harvested records from JSON arrays.
 *
 * <p>Field names are accepted in camelCase or snake_case. A record that fails
 * validation is skipped with a malformed-record warning; only an unreadable
 * file or a document that is not an array raises {@link IOException}.
 */
public class RecordLoader {

    public static final String STAGE = "ingest";

    private static final Logger log = LoggerFactory.getLogger(RecordLoader.class);

    private final ObjectMapper objectMapper;

    public RecordLoader() {
        this(new ObjectMapper());
    }

    public RecordLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public LoadResult<CommitRecord> loadCommits(Path file) throws IOException {
        return parse(read(file), "commit", this::toCommit);
    }

    public LoadResult<PullRequestRecord> loadPullRequests(Path file) throws IOException {
        return parse(read(file), "pull request", this::toPullRequest);
    }

    public LoadResult<DeploymentRecord> loadDeployments(Path file) throws IOException {
        return parse(read(file), "deployment", this::toDeployment);
    }

    public LoadResult<IncidentRecord> loadIncidents(Path file) throws IOException {
        return parse(read(file), "incident", this::toIncident);
    }

    public LoadResult<CommitRecord> parseCommits(String json) throws IOException {
        return parse(objectMapper.readTree(json), "commit", this::toCommit);
    }

    public LoadResult<PullRequestRecord> parsePullRequests(String json) throws IOException {
        return parse(objectMapper.readTree(json), "pull request", this::toPullRequest);
    }

    public LoadResult<DeploymentRecord> parseDeployments(String json) throws IOException {
        return parse(objectMapper.readTree(json), "deployment", this::toDeployment);
    }

    public LoadResult<IncidentRecord> parseIncidents(String json) throws IOException {
        return parse(objectMapper.readTree(json), "incident", this::toIncident);
    }

    private JsonNode read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("No such file: " + file);
        }
        log.debug("Reading {}", file);
        return objectMapper.readTree(file.toFile());
    }

    private <T> LoadResult<T> parse(JsonNode root, String label, Function<JsonNode, T> mapper) throws IOException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return LoadResult.empty();
        }
        if (!root.isArray()) {
            throw new IOException("Expected a JSON array of " + label + " records but found " + root.getNodeType());
        }

        List<T> records = new ArrayList<>();
        List<AnalysisWarning> warnings = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            try {
                if (!node.isObject()) {
                    throw new MalformedRecordException("#" + index, "not a JSON object");
                }
                records.add(mapper.apply(node));
            } catch (MalformedRecordException e) {
                log.warn("Skipping {} {} at index {}: {}", label, e.getRecordId(), index, e.getMessage());
                warnings.add(AnalysisWarning.malformed(STAGE,
                        label + " " + e.getRecordId() + " at index " + index + ": " + e.getMessage()));
            }
            index++;
        }
        log.debug("Loaded {} {} records, skipped {}", records.size(), label, warnings.size());
        return new LoadResult<>(records, warnings);
    }

    private CommitRecord toCommit(JsonNode node) {
        String sha = text(node, "sha", "sha");
        return new CommitRecord(
                sha,
                text(node, "author", "author"),
                instant(node, sha, "timestamp", "timestamp"),
                integer(node, sha, "additions", "additions", true),
                integer(node, sha, "deletions", "deletions", true),
                integer(node, sha, "filesChanged", "files_changed", false),
                text(node, "message", "message"));
    }

    private PullRequestRecord toPullRequest(JsonNode node) {
        String id = text(node, "id", "id");
        return new PullRequestRecord(
                id,
                text(node, "author", "author"),
                instant(node, id, "createdAt", "created_at"),
                instant(node, id, "mergedAt", "merged_at"),
                integer(node, id, "reviewCount", "review_count", false),
                integer(node, id, "additions", "additions", true),
                integer(node, id, "deletions", "deletions", true),
                integer(node, id, "filesChanged", "files_changed", false),
                CiStatus.parse(text(node, "ciStatus", "ci_status")));
    }

    private DeploymentRecord toDeployment(JsonNode node) {
        String id = text(node, "id", "id");
        String rawStatus = text(node, "status", "status");
        DeploymentStatus status = DeploymentStatus.parse(rawStatus);
        if (rawStatus != null && status == null) {
            throw new MalformedRecordException(id == null ? "?" : id, "unknown status '" + rawStatus + "'");
        }
        return new DeploymentRecord(id, instant(node, id, "timestamp", "timestamp"), status);
    }

    private IncidentRecord toIncident(JsonNode node) {
        String id = text(node, "id", "id");
        return new IncidentRecord(
                id,
                instant(node, id, "detectedAt", "detected_at"),
                instant(node, id, "resolvedAt", "resolved_at"));
    }

    private static JsonNode field(JsonNode node, String camel, String snake) {
        JsonNode value = node.get(camel);
        if (value == null || value.isNull()) {
            value = node.get(snake);
        }
        return value == null || value.isNull() ? null : value;
    }

    private static String text(JsonNode node, String camel, String snake) {
        JsonNode value = field(node, camel, snake);
        return value == null ? null : value.asText();
    }

    private static int integer(JsonNode node, String id, String camel, String snake, boolean required) {
        JsonNode value = field(node, camel, snake);
        if (value == null) {
            if (required) {
                throw new MalformedRecordException(id == null ? "?" : id, "missing " + camel);
            }
            return 0;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new MalformedRecordException(id == null ? "?" : id, camel + " is not an integer: " + value);
        }
        return value.intValue();
    }

    // Null when absent; the record constructor decides whether that is allowed
    private static Instant instant(JsonNode node, String id, String camel, String snake) {
        String value = text(node, camel, snake);
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException(id == null ? "?" : id,
                    camel + " is not an ISO-8601 timestamp: " + value);
        }
    }
}
