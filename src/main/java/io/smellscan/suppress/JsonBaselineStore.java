package io.smellscan.suppress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Stores a baseline as a JSON document:
 * <pre>
 * {
 *   "version": 1,
 *   "fingerprints": ["0a1b...", "..."]
 * }
 * </pre>
 * Writes go to a temporary file that is then moved over the target.
 */
public class JsonBaselineStore implements BaselineStore {

    private static final Logger log = LoggerFactory.getLogger(JsonBaselineStore.class);
    private static final int FORMAT_VERSION = 1;

    private final Path file;
    private final ObjectMapper mapper;

    public JsonBaselineStore(Path file) {
        this.file = file;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * JSON structure of the baseline file.
     */
    public record BaselineDocument(int version, List<String> fingerprints) {
    }

    @Override
    public Baseline load() throws IOException {
        if (!Files.exists(file)) {
            log.info("No baseline at {}, starting from an empty baseline", file);
            return Baseline.empty();
        }
        BaselineDocument document;
        try {
            document = mapper.readValue(file.toFile(), BaselineDocument.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid baseline file " + file + ": " + e.getOriginalMessage(), e);
        }
        if (document.version() != FORMAT_VERSION) {
            throw new IOException("Unsupported baseline version " + document.version() + " in " + file);
        }
        Baseline baseline = document.fingerprints() == null
                ? Baseline.empty()
                : Baseline.of(document.fingerprints());
        log.debug("Loaded {} baseline fingerprint(s) from {}", baseline.size(), file);
        return baseline;
    }

    @Override
    public void save(Baseline baseline) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            mapper.writeValue(temp.toFile(), new BaselineDocument(FORMAT_VERSION, List.copyOf(baseline.fingerprints())));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Wrote {} fingerprint(s) to baseline {}", baseline.size(), file);
    }

    public Path getFile() {
        return file;
    }
}
