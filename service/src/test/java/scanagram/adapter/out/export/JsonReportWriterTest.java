package scanagram.adapter.out.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static scanagram.mock.TestData.post;
import static scanagram.mock.TestData.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import scanagram.core.model.report.ExportFormat;

@DisplayName("JsonReportWriter")
class JsonReportWriterTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final JsonReportWriter writer = new JsonReportWriter(mapper);

    @TempDir
    Path directory;

    @Test
    @DisplayName("should write the report as indented JSON with ISO-8601 dates")
    void shouldWriteJson() throws IOException {
        final var report = report(
                "alice",
                List.of(
                        post("a", "2024-03-01T10:00:00Z", 100, 10, Set.of("travel"), "Rome"),
                        post("b", "2024-03-02T11:00:00Z", 50, 5)));
        final var target = directory.resolve("report.json");

        writer.write(report, target);

        final var content = Files.readString(target);
        assertTrue(content.contains("\n"), "should be pretty-printed");

        final var json = mapper.readTree(content);
        assertEquals("alice", json.get("username").asText());
        assertEquals(2, json.get("posts").size());
        assertEquals(2, json.get("engagement").get("sampleSize").asInt());
        assertEquals("travel", json.get("engagement").get("topHashtags").get(0).get("value").asText());
        assertEquals("2024-06-01T12:00:00Z", json.get("collection").get("generatedAt").asText());
        assertEquals("PT12S", json.get("collection").get("duration").asText());
        assertEquals("2024-03-01T10:00:00Z", json.get("posts").get(0).get("timestamp").asText());
    }

    @Test
    @DisplayName("should report the JSON format")
    void shouldReportFormat() {
        assertEquals(ExportFormat.JSON, writer.format());
    }
}
