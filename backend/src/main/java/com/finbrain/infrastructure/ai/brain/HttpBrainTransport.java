package com.finbrain.infrastructure.ai.brain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp transport to the AI Brain HTTP server. Each call carries its own timeout covering connect,
 * write, server processing and body read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpBrainTransport implements BrainTransport {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient brainHttpClient;
    private final ObjectMapper objectMapper;
    private final BrainProperties properties;

    @Override
    public BrainReply query(BrainQuery query, Duration timeout) {
        String body;
        try {
            body = objectMapper.writeValueAsString(query);
        } catch (JsonProcessingException e) {
            throw new PermanentRemoteException("Failed to serialize brain query", e);
        }

        Request request = new Request.Builder()
                .url(endpoint("/query"))
                .post(RequestBody.create(body, JSON))
                .build();

        Call call = brainHttpClient.newCall(request);
        call.timeout().timeout(callTimeoutMillis(timeout), TimeUnit.MILLISECONDS);

        long start = System.currentTimeMillis();
        try (Response response = call.execute()) {
            int status = response.code();
            if (status >= 500 || status == 429) {
                throw new TransientNetworkException("AI Brain returned HTTP " + status, status);
            }
            if (!response.isSuccessful()) {
                throw new PermanentRemoteException("AI Brain rejected the query with HTTP " + status);
            }
            BrainReply reply = readReply(response.body());
            log.debug("[HttpBrainTransport] {} answered in {}ms", query.mode(), System.currentTimeMillis() - start);
            return reply;
        } catch (IOException e) {
            throw new TransientNetworkException("AI Brain call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isHealthy(Duration timeout) {
        Request request = new Request.Builder().url(endpoint("/health")).get().build();
        Call call = brainHttpClient.newCall(request);
        call.timeout().timeout(callTimeoutMillis(timeout), TimeUnit.MILLISECONDS);
        try (Response response = call.execute()) {
            return response.isSuccessful();
        } catch (IOException e) {
            log.debug("[HttpBrainTransport] Health check failed: {}", e.getMessage());
            return false;
        }
    }

    private BrainReply readReply(ResponseBody body) throws IOException {
        if (body == null) {
            throw new PermanentRemoteException("AI Brain returned an empty body");
        }
        BrainReply reply;
        try {
            reply = objectMapper.readValue(body.string(), BrainReply.class);
        } catch (JsonProcessingException e) {
            throw new PermanentRemoteException("AI Brain returned an unreadable envelope", e);
        }
        if (reply == null || (reply.response() == null && reply.parsedData() == null)) {
            throw new PermanentRemoteException("AI Brain envelope has no response");
        }
        return reply;
    }

    // OkHttp reads 0 as no timeout at all
    static long callTimeoutMillis(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            return 1L;
        }
        return Math.max(1L, timeout.toMillis());
    }

    private String endpoint(String path) {
        String base = properties.getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) + path : base + path;
    }
}
