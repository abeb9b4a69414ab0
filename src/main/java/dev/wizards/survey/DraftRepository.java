package dev.wizards.survey;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores wizard context snapshots as JSON files, one {@code <draftId>.json} per draft.
 * The draft id is the reference number of the context.
 */
public class DraftRepository {

    private static final Logger logger = LoggerFactory.getLogger(DraftRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<Map<String, Object>> SNAPSHOT_TYPE = new TypeReference<>() {};

    /** One line of the draft list. */
    public record DraftSummary(
        String draftId,
        String status,
        int currentStepIndex,
        String updatedAt
    ) {}

    private final Path directory;

    public DraftRepository(Path directory) {
        this.directory = directory;
    }

    public Path directory() { return directory; }

    /**
     * Write the snapshot, replacing an earlier draft with the same reference number.
     *
     * @return the draft id
     */
    public String save(Map<String, Object> snapshot) throws IOException {
        Object reference = snapshot.get("reference_number");
        if (reference == null || reference.toString().isBlank()) {
            throw new IllegalArgumentException("Snapshot has no reference_number");
        }
        String draftId = reference.toString();
        Files.createDirectories(directory);
        MAPPER.writeValue(fileFor(draftId).toFile(), snapshot);
        logger.debug("Wrote draft {} to {}", draftId, directory);
        return draftId;
    }

    public Optional<Map<String, Object>> load(String draftId) throws IOException {
        Path file = fileFor(draftId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(MAPPER.readValue(file.toFile(), SNAPSHOT_TYPE));
    }

    public boolean delete(String draftId) throws IOException {
        return Files.deleteIfExists(fileFor(draftId));
    }

    /** All drafts in the directory, sorted by draft id. */
    public List<DraftSummary> list() throws IOException {
        var drafts = new ArrayList<DraftSummary>();
        if (!Files.isDirectory(directory)) {
            return drafts;
        }
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(p -> p.getFileName().toString().endsWith(".json"))
                 .sorted()
                 .forEach(p -> {
                     try {
                         drafts.add(summarize(MAPPER.readValue(p.toFile(), SNAPSHOT_TYPE)));
                     } catch (IOException e) {
                         throw new UncheckedIOException("Failed to read draft " + p, e);
                     }
                 });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return drafts;
    }

    private static DraftSummary summarize(Map<String, Object> snapshot) {
        Object step = snapshot.get("current_step_index");
        return new DraftSummary(
            String.valueOf(snapshot.get("reference_number")),
            String.valueOf(snapshot.get("status")),
            step instanceof Number n ? n.intValue() : 0,
            String.valueOf(snapshot.get("updated_at")));
    }

    private Path fileFor(String draftId) {
        if (draftId.contains("/") || draftId.contains("\\") || draftId.contains("..")) {
            throw new IllegalArgumentException("Invalid draft id: " + draftId);
        }
        return directory.resolve(draftId + ".json");
    }
}
