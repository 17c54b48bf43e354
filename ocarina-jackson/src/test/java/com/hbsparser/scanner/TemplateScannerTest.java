package com.hbsparser.scanner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hbsparser.jackson.OcarinaJackson;
import com.hbsparser.tokens.TokenOccurrence;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateScannerTest {

    @TempDir
    Path tempDir;

    private Path writeTemplates() throws Exception {
        Path sources = tempDir.resolve("app");
        Files.createDirectories(sources.resolve("components"));
        Files.createDirectories(sources.resolve("node_modules/addon"));
        Files.writeString(sources.resolve("components/card.hbs"), "<MyComponent />{{format-name @name}}");
        Files.writeString(sources.resolve("components/list.hbs"),
            "{{#each @items as |Item|}}<Item />{{/each}}");
        Files.writeString(sources.resolve("components/broken.hbs"), "<div>\n  <p></div>");
        Files.writeString(sources.resolve("components/notes.txt"), "{{ignored}}");
        Files.writeString(sources.resolve("node_modules/addon/vendor.hbs"), "{{vendor}}");
        return sources;
    }

    @Test
    void scansMatchingTemplatesAndRecordsFailures() throws Exception {
        Path sources = writeTemplates();
        TemplateScanner.Config config = TemplateScanner.Config.parse(new String[] {"--threads=2", sources.toString()});

        TemplateScanner.ScanReport report = new TemplateScanner(config).scan();

        assertEquals(2, report.tokens().size());
        List<String> card = report.tokens().get(sources.resolve("components/card.hbs")).stream()
            .map(TokenOccurrence::name).toList();
        assertEquals(List.of("my-component", "format-name"), card);
        List<String> list = report.tokens().get(sources.resolve("components/list.hbs")).stream()
            .map(TokenOccurrence::name).toList();
        assertEquals(List.of("each"), list);

        assertEquals(1, report.failures().size());
        TemplateScanner.FailureRecord failure = report.failures().get(0);
        assertEquals(sources.resolve("components/broken.hbs"), failure.file());
        assertEquals(2, failure.line());
        assertEquals(5, failure.column());
    }

    @Test
    void runWritesReportAndSignalsFailures() throws Exception {
        Path sources = writeTemplates();
        Path output = tempDir.resolve("out/report.json");
        TemplateScanner.Config config = TemplateScanner.Config.parse(
            new String[] {sources.toString(), "--output=" + output, "--verbose"});

        assertEquals(1, new TemplateScanner(config).run());

        ObjectMapper mapper = OcarinaJackson.createObjectMapper();
        JsonNode report = mapper.readTree(Files.readString(output));
        assertEquals(2, report.get("files").size());
        assertTrue(report.at("/files/0/file").asText().endsWith("card.hbs"));
        assertEquals("my-component", report.at("/files/0/tokens/0/name").asText());
        assertEquals(1, report.get("failures").size());
        assertEquals(2, report.at("/failures/0/line").asInt());
    }

    @Test
    void extensionsFlagSelectsFiles() throws Exception {
        Path sources = writeTemplates();
        TemplateScanner.Config config = TemplateScanner.Config.parse(
            new String[] {"--extensions=txt", sources.toString()});

        TemplateScanner.ScanReport report = new TemplateScanner(config).scan();

        assertEquals(1, report.tokens().size());
        assertTrue(report.failures().isEmpty());
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertNull(TemplateScanner.Config.parse(new String[] {}));
        assertNull(TemplateScanner.Config.parse(new String[] {"--threads=0", "dir"}));
        assertNull(TemplateScanner.Config.parse(new String[] {"--threads=many", "dir"}));
        assertNull(TemplateScanner.Config.parse(new String[] {"--bogus", "dir"}));
        assertNull(TemplateScanner.Config.parse(new String[] {"--help"}));

        TemplateScanner.Config config = TemplateScanner.Config.parse(
            new String[] {"--threads=3", "--extensions=hbs,handlebars", "a", "b"});
        assertEquals(3, config.threads);
        assertEquals(List.of("hbs", "handlebars"), config.extensions);
        assertEquals(List.of(Path.of("a"), Path.of("b")), config.sourceDirs);
    }
}
