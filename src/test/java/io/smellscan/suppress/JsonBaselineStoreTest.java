package io.smellscan.suppress;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonBaselineStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void load_missingFileGivesEmptyBaseline() throws IOException {
        JsonBaselineStore store = new JsonBaselineStore(tempDir.resolve("baseline.json"));

        assertThat(store.load().isEmpty()).isTrue();
    }

    @Test
    void save_writesSortedFingerprintsThatLoadBack() throws IOException {
        Path file = tempDir.resolve("nested/baseline.json");
        JsonBaselineStore store = new JsonBaselineStore(file);

        store.save(Baseline.of(Set.of("bbb", "aaa")));

        assertThat(Files.readString(file)).contains("\"version\"").containsSubsequence("aaa", "bbb");
        assertThat(store.load().fingerprints()).containsExactly("aaa", "bbb");
    }

    @Test
    void load_rejectsMalformedFile() throws IOException {
        Path file = tempDir.resolve("baseline.json");
        Files.writeString(file, "{ not json");

        assertThatThrownBy(() -> new JsonBaselineStore(file).load())
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid baseline file");
    }

    @Test
    void load_rejectsUnsupportedVersion() throws IOException {
        Path file = tempDir.resolve("baseline.json");
        Files.writeString(file, "{\"version\": 99, \"fingerprints\": []}");

        assertThatThrownBy(() -> new JsonBaselineStore(file).load())
                .isInstanceOf(IOException.class)
                .hasMessageContaining("99");
    }
}
