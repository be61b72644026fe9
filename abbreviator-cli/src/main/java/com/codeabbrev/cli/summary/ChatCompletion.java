package com.codeabbrev.cli.summary;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Gson-serializable request and response bodies of an OpenAI-compatible
 * {@code chat/completions} call. Only the fields this client uses are mapped.
 */
public final class ChatCompletion {

    private ChatCompletion() {}

    public static class Message {
        public String role;
        public String content;

        public Message() {}

        public Message(String role, String content) {
            this.role = role;
            this.content = content;
        }
    }

    public static class Request {
        public String model;
        public List<Message> messages;

        @SerializedName("max_tokens")
        public int maxTokens;

        public double temperature;

        @SerializedName("top_p")
        public double topP;

        public boolean stream;
    }

    public static class Response {
        public List<Choice> choices;
    }

    public static class Choice {
        public Message message;

        @SerializedName("finish_reason")
        public String finishReason;
    }
}
