package com.phillippitts.windowanalysis.service.provider.transport;

import com.phillippitts.windowanalysis.exception.TransportException;
import com.phillippitts.windowanalysis.service.provider.TranslatedRequest;
import com.phillippitts.windowanalysis.util.LogSanitizer;
import com.phillippitts.windowanalysis.util.TimeUtils;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProviderTransport} over a shared {@link OkHttpClient}.
 *
 * <p>The per-call timeout is applied with {@link Call#timeout()}, which bounds the whole call
 * (DNS, connect, write, server processing, read).
 */
public class OkHttpProviderTransport implements ProviderTransport {

    private static final Logger LOG = LogManager.getLogger(OkHttpProviderTransport.class);
    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");
    private static final int ERROR_BODY_PREVIEW = 500;

    private final OkHttpClient client;

    public OkHttpProviderTransport(OkHttpClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public String send(String providerId, TranslatedRequest translated, long timeoutMs) {
        Request request = toOkHttpRequest(translated);
        Call call = client.newCall(request);
        if (timeoutMs > 0) {
            call.timeout().timeout(timeoutMs, TimeUnit.MILLISECONDS);
        }

        long start = System.nanoTime();
        try (Response response = call.execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";
            long elapsed = TimeUtils.elapsedMillis(start);

            if (!response.isSuccessful()) {
                LOG.warn("Provider {} returned HTTP {} in {}ms: {}", providerId, response.code(), elapsed,
                        LogSanitizer.preview(body, 200));
                throw new TransportException("HTTP " + response.code() + " from " + providerId,
                        providerId, response.code(), LogSanitizer.truncate(body, ERROR_BODY_PREVIEW));
            }

            LOG.debug("Provider {} responded in {}ms ({} chars)", providerId, elapsed, body.length());
            return body;
        } catch (InterruptedIOException e) {
            LOG.warn("Provider {} call timed out after {}ms", providerId, TimeUtils.elapsedMillis(start));
            throw new TransportException("Call to " + providerId + " timed out", providerId, true, e);
        } catch (IOException e) {
            LOG.warn("Provider {} network error: {}", providerId, e.toString());
            throw new TransportException("Network error calling " + providerId + ": " + e.getMessage(),
                    providerId, false, e);
        }
    }

    private static Request toOkHttpRequest(TranslatedRequest translated) {
        Request.Builder builder = new Request.Builder().url(translated.url());
        for (Map.Entry<String, String> header : translated.headers().entrySet()) {
            builder.addHeader(header.getKey(), header.getValue());
        }
        RequestBody body = translated.body() == null ? null : RequestBody.create(translated.body(), JSON_MEDIA);
        return builder.method(translated.method(), body).build();
    }
}
