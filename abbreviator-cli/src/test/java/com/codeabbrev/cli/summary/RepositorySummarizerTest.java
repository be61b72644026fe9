package com.codeabbrev.cli.summary;

import com.codeabbrev.cli.config.AbbreviatorConfig;
import com.codeabbrev.core.AbbreviationOptions;
import com.codeabbrev.core.CodeAbbreviator;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class RepositorySummarizerTest {

    private static final Path SAMPLE_REPO = Paths.get(System.getProperty("user.dir"))
            .getParent()
            .resolve("test-fixtures/sample-repo");

    @Test
    void summarizesEachLargeEnoughScriptAndSurvivesFailures(@TempDir Path tmp) throws IOException {
        QueuedChatResponses server = new QueuedChatResponses();
        server.enqueueCompletion("Marks the package.");
        server.enqueueJson(500, "{\"error\": \"overloaded\"}");
        SummaryClient client = new SummaryClient(new AbbreviatorConfig(), "key",
                new OkHttpClient.Builder().addInterceptor(server).build());

        Map<String, String> summaries = new RepositorySummarizer(new CodeAbbreviator(), client).summarize(
                SAMPLE_REPO, AbbreviationOptions.withPreserveChars(90), 10,
                tmp.resolve("abbreviations"), tmp.resolve("summaries"));

        assertEquals(Map.of("pkg/__init__.py", "Marks the package."), summaries);
        assertEquals("Marks the package.",
                Files.readString(tmp.resolve("summaries/pkg/__init__.py.summary.txt")));
        assertFalse(Files.exists(tmp.resolve("summaries/pkg/utils.py.summary.txt")));
        // tiny.py is below the size threshold and never reaches the service
        assertEquals(2, server.requests().size());

        List<String> abbreviations;
        try (Stream<Path> files = Files.list(tmp.resolve("abbreviations"))) {
            abbreviations = files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
        assertEquals(2, abbreviations.size());
        assertTrue(abbreviations.get(0).matches("__init___depth2_\\d+\\.py"), abbreviations.toString());
        assertTrue(abbreviations.get(1).matches("utils_depth2_\\d+\\.py"), abbreviations.toString());
    }

    @Test
    void uncheckedFailureOnOneScriptDoesNotStopTheWalk(@TempDir Path tmp) {
        QueuedChatResponses server = new QueuedChatResponses();
        server.enqueueCompletion("Helpers for the package.");
        SummaryClient client = new SummaryClient(new AbbreviatorConfig(), "key",
                new OkHttpClient.Builder().addInterceptor(server).build());
        CodeAbbreviator failingOnInit = new CodeAbbreviator() {
            @Override
            public String abbreviateCode(String source, AbbreviationOptions options) {
                if (source.startsWith("\"\"\"Package.")) {
                    throw new IllegalStateException("abbreviation crashed");
                }
                return super.abbreviateCode(source, options);
            }
        };

        Map<String, String> summaries = new RepositorySummarizer(failingOnInit, client).summarize(
                SAMPLE_REPO, AbbreviationOptions.withPreserveChars(90), 10,
                tmp.resolve("abbreviations"), tmp.resolve("summaries"));

        assertEquals(Map.of("pkg/utils.py", "Helpers for the package."), summaries);
        assertEquals(1, server.requests().size());
    }

    @Test
    void missingRepositoryThrows(@TempDir Path tmp) {
        RepositorySummarizer summarizer = new RepositorySummarizer(new CodeAbbreviator(),
                new SummaryClient(new AbbreviatorConfig(), "key", new OkHttpClient()));
        assertThrows(SummaryClient.SummaryException.class, () -> summarizer.summarize(
                tmp.resolve("absent"), AbbreviationOptions.withPreserveChars(90), 10, tmp, tmp));
    }
}
