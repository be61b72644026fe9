package com.codeabbrev.cli.summary;

import com.codeabbrev.cli.config.AbbreviatorConfig;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SummaryClientTest {

    private QueuedChatResponses server;
    private SummaryClient client;

    @BeforeEach
    void setUp() {
        server = new QueuedChatResponses();
        OkHttpClient http = new OkHttpClient.Builder().addInterceptor(server).build();
        client = new SummaryClient(new AbbreviatorConfig(), "secret-key", http);
    }

    @Test
    void postsChatCompletionAndReturnsContent() {
        server.enqueueCompletion("Parses arguments and prints a greeting.");

        String summary = client.summarize("def main():\n    # ...\n    pass\n");

        assertEquals("Parses arguments and prints a greeting.", summary);
        QueuedChatResponses.Captured sent = server.requests().get(0);
        assertEquals("POST", sent.request().method());
        assertEquals("/v1/chat/completions", sent.request().url().encodedPath());
        assertEquals("Bearer secret-key", sent.request().header("Authorization"));

        JsonObject body = JsonParser.parseString(sent.body()).getAsJsonObject();
        assertEquals("deepseek-ai/DeepSeek-V3", body.get("model").getAsString());
        assertEquals(2048, body.get("max_tokens").getAsInt());
        assertEquals(0.95, body.get("top_p").getAsDouble());
        String prompt = body.getAsJsonArray("messages").get(0).getAsJsonObject().get("content").getAsString();
        assertTrue(prompt.contains("<SCRIPT>\ndef main():\n    # ...\n    pass\n\n</SCRIPT>"), prompt);
        assertFalse(prompt.contains("{script}"));
    }

    @Test
    void indeterminateAnswerIsRecognized() {
        server.enqueueCompletion("[_INDETERMINATE_]\n");
        assertTrue(SummaryClient.isIndeterminate(client.summarize("x = 1\n")));
        assertFalse(SummaryClient.isIndeterminate("Sets x."));
    }

    @Test
    void errorStatusThrowsSummaryException() {
        server.enqueueJson(429, "{\"error\": \"rate limited\"}");
        SummaryClient.SummaryException e = assertThrows(SummaryClient.SummaryException.class,
                () -> client.summarize("x = 1\n"));
        assertTrue(e.getMessage().contains("429"), e.getMessage());
    }

    @Test
    void responseWithoutChoicesThrowsSummaryException() {
        server.enqueueJson(200, "{\"choices\": []}");
        assertThrows(SummaryClient.SummaryException.class, () -> client.summarize("x = 1\n"));
    }

    @Test
    void malformedResponseThrowsSummaryException() {
        server.enqueueJson(200, "<html>");
        assertThrows(SummaryClient.SummaryException.class, () -> client.summarize("x = 1\n"));
    }

    @Test
    void transportFailureThrowsSummaryException() {
        assertThrows(SummaryClient.SummaryException.class, () -> client.summarize("x = 1\n"));
    }

    @Test
    void endpointIsResolvedUnderTheApiBase() {
        assertEquals("http://localhost:8000/v1/chat/completions",
                SummaryClient.chatEndpoint("http://localhost:8000/v1").toString());
        assertEquals("https://api.hyperbolic.xyz/v1/chat/completions",
                SummaryClient.chatEndpoint("https://api.hyperbolic.xyz/v1/").toString());
    }

    @Test
    void apiKeyIsReadTrimmed(@TempDir Path tmp) throws IOException {
        Path keyFile = tmp.resolve("key.txt");
        Files.writeString(keyFile, "  abc123\n");
        assertEquals("abc123", SummaryClient.readApiKey(keyFile));

        Files.writeString(keyFile, "\n");
        assertThrows(SummaryClient.SummaryException.class, () -> SummaryClient.readApiKey(keyFile));
        assertThrows(SummaryClient.SummaryException.class, () -> SummaryClient.readApiKey(tmp.resolve("none")));
    }
}
