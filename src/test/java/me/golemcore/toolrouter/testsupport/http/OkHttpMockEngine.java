package me.golemcore.toolrouter.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted OkHttp interceptor for backend adapter tests.
 * <p>
 * Requests never reach the network: each call takes the next planned exchange
 * (a response with optional headers, or an I/O failure) and is captured for
 * assertions.
 */
public final class OkHttpMockEngine implements Interceptor {

    private final ConcurrentLinkedQueue<Exchange> planned = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CapturedRequest> captured = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    /**
     * Client that routes every call through this engine.
     */
    public OkHttpClient client() {
        return new OkHttpClient.Builder()
                .addInterceptor(this)
                .retryOnConnectionFailure(false)
                .build();
    }

    public void enqueue(int code, String body, String contentType) {
        enqueue(code, body, contentType, Map.of());
    }

    public void enqueue(int code, String body, String contentType, Map<String, String> headers) {
        planned.add(new Exchange(code, body != null ? body : "", contentType, Headers.of(headers), null));
    }

    public void enqueueJson(int code, String body) {
        enqueue(code, body, "application/json");
    }

    public void enqueueFailure(IOException failure) {
        planned.add(new Exchange(0, "", null, Headers.of(), failure));
    }

    public CapturedRequest takeRequest() {
        return captured.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        captured.add(new CapturedRequest(request, readBody(request)));
        requestCount.incrementAndGet();

        Exchange exchange = planned.poll();
        if (exchange == null) {
            throw new IOException("No planned response for " + request.method() + " " + request.url());
        }
        if (exchange.failure() != null) {
            throw exchange.failure();
        }
        MediaType mediaType = exchange.contentType() != null ? MediaType.parse(exchange.contentType()) : null;
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(exchange.code())
                .message("mock")
                .headers(exchange.headers())
                .body(ResponseBody.create(exchange.body(), mediaType))
                .build();
    }

    private static String readBody(Request request) throws IOException {
        RequestBody body = request.body();
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Exchange(int code, String body, String contentType, Headers headers, IOException failure) {
    }

    /**
     * A request as the adapter sent it.
     */
    public static final class CapturedRequest {
        private final Request request;
        private final String body;

        private CapturedRequest(Request request, String body) {
            this.request = request;
            this.body = body;
        }

        public String method() {
            return request.method();
        }

        public String url() {
            return request.url().toString();
        }

        public String header(String name) {
            return request.header(name);
        }

        public String contentType() {
            return request.body() != null && request.body().contentType() != null
                    ? request.body().contentType().toString()
                    : null;
        }

        public String body() {
            return body;
        }
    }
}
