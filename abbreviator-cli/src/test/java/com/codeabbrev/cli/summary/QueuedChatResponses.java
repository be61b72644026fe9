package com.codeabbrev.cli.summary;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Application interceptor that answers every call from a queue of canned
 * responses and records the requests. No network I/O happens.
 */
final class QueuedChatResponses implements Interceptor {

    record Captured(Request request, String body) {}

    private final Deque<Integer> codes = new ArrayDeque<>();
    private final Deque<String> bodies = new ArrayDeque<>();
    private final List<Captured> requests = new ArrayList<>();

    void enqueueJson(int code, String body) {
        codes.add(code);
        bodies.add(body);
    }

    /** Queues a successful completion whose message is {@code content}. */
    void enqueueCompletion(String content) {
        String escaped = content.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
        enqueueJson(200, "{\"choices\": [{\"index\": 0, \"message\": {\"role\": \"assistant\", \"content\": \""
                + escaped + "\"}, \"finish_reason\": \"stop\"}]}");
    }

    List<Captured> requests() {
        return requests;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        requests.add(new Captured(request, readBody(request)));
        if (codes.isEmpty()) {
            throw new IOException("No queued response for " + request.url());
        }
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(codes.poll())
                .message("queued")
                .body(ResponseBody.create(bodies.poll(), MediaType.get("application/json")))
                .build();
    }

    private static String readBody(Request request) throws IOException {
        RequestBody body = request.body();
        if (body == null) return "";
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }
}
