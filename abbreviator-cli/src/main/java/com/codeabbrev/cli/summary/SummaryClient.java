package com.codeabbrev.cli.summary;

import com.codeabbrev.cli.config.AbbreviatorConfig;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Asks an OpenAI-compatible chat completion endpoint for a short summary of
 * an abbreviated script.
 */
public class SummaryClient {

    /** Returned by the model when it cannot tell what a script does. */
    public static final String INDETERMINATE = "[_INDETERMINATE_]";

    static final String PROMPT_RESOURCE = "/prompts/abbreviated_script.txt";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Gson GSON = new Gson();

    public static class SummaryException extends RuntimeException {
        public SummaryException(String msg) { super(msg); }
        public SummaryException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final OkHttpClient httpClient;
    private final HttpUrl endpoint;
    private final String apiKey;
    private final AbbreviatorConfig config;
    private final String promptTemplate;

    public SummaryClient(AbbreviatorConfig config, String apiKey, OkHttpClient baseHttpClient) {
        this.config = config;
        this.apiKey = apiKey;
        this.endpoint = chatEndpoint(config.getLlmApiBase());
        this.promptTemplate = loadPromptTemplate();

        int timeoutSeconds = config.getLlmTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Reads the API key from {@code keyFile}, trimmed.
     *
     * @throws SummaryException if the file is missing, unreadable or blank
     */
    public static String readApiKey(Path keyFile) {
        if (!Files.isRegularFile(keyFile)) {
            throw new SummaryException("API key file not found: " + keyFile);
        }
        try {
            String key = Files.readString(keyFile, StandardCharsets.UTF_8).strip();
            if (key.isEmpty()) {
                throw new SummaryException("API key file is empty: " + keyFile);
            }
            return key;
        } catch (IOException e) {
            throw new SummaryException("Failed to read API key file " + keyFile + ": " + e.getMessage(), e);
        }
    }

    public static boolean isIndeterminate(String summary) {
        return summary != null && summary.strip().equals(INDETERMINATE);
    }

    /** Fills the prompt template with {@code script}. */
    public String prompt(String script) {
        return promptTemplate.replace("{script}", script);
    }

    /**
     * Summarizes {@code abbreviatedScript}.
     *
     * @return the model's answer, possibly {@link #INDETERMINATE}
     * @throws SummaryException on transport errors, non-2xx answers or bodies without a message
     */
    public String summarize(String abbreviatedScript) {
        ChatCompletion.Request body = new ChatCompletion.Request();
        body.model = config.getLlmModel();
        body.messages = List.of(new ChatCompletion.Message("user", prompt(abbreviatedScript)));
        body.maxTokens = config.getLlmMaxTokens();
        body.temperature = config.getLlmTemperature();
        body.topP = config.getLlmTopP();
        body.stream = false;

        Request request = new Request.Builder()
                .url(endpoint)
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(GSON.toJson(body), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful()) {
                String detail = responseBody != null ? responseBody.string() : "";
                throw new SummaryException("Summary request failed: HTTP " + response.code() + " " + detail);
            }
            if (responseBody == null) {
                throw new SummaryException("Summary response had no body");
            }
            return extractContent(responseBody.string());
        } catch (IOException e) {
            throw new SummaryException("Summary request error: " + e.getMessage(), e);
        }
    }

    private static String extractContent(String json) {
        ChatCompletion.Response parsed;
        try {
            parsed = GSON.fromJson(json, ChatCompletion.Response.class);
        } catch (JsonParseException e) {
            throw new SummaryException("Malformed summary response: " + e.getMessage(), e);
        }
        if (parsed == null || parsed.choices == null || parsed.choices.isEmpty()
                || parsed.choices.get(0).message == null || parsed.choices.get(0).message.content == null) {
            throw new SummaryException("Summary response contained no message");
        }
        return parsed.choices.get(0).message.content;
    }

    static HttpUrl chatEndpoint(String apiBase) {
        String base = apiBase.endsWith("/") ? apiBase : apiBase + "/";
        HttpUrl parsed = HttpUrl.parse(base);
        if (parsed == null) {
            throw new SummaryException("Invalid LLM API base URL: " + apiBase);
        }
        return parsed.resolve("chat/completions");
    }

    private static String loadPromptTemplate() {
        try (InputStream in = SummaryClient.class.getResourceAsStream(PROMPT_RESOURCE)) {
            if (in == null) {
                throw new SummaryException("Prompt template resource missing: " + PROMPT_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new SummaryException("Failed to load prompt template: " + e.getMessage(), e);
        }
    }
}
