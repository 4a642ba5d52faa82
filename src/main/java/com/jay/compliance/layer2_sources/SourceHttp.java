package com.jay.compliance.layer2_sources;

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.TimeUnit;

/**
 * Shared OkHttp plumbing for the source adapters: builds clients from timeouts and
 * maps HTTP outcomes onto the adapter error taxonomy. Response bodies and query
 * strings are never copied into exceptions or logs; they may carry names.
 */
@Slf4j
final class SourceHttp {

    private SourceHttp() {}

    static OkHttpClient client(int connectSeconds, int readSeconds, int callSeconds) {
        return new OkHttpClient.Builder()
            .connectTimeout(connectSeconds, TimeUnit.SECONDS)
            .readTimeout(readSeconds, TimeUnit.SECONDS)
            .callTimeout(callSeconds, TimeUnit.SECONDS)
            .build();
    }

    static String execute(OkHttpClient http, Request request, String source) {
        String path = request.url().encodedPath();
        try (Response response = http.newCall(request).execute()) {
            int code = response.code();
            if (code == 404) {
                throw new NotFoundException(source, "Resource not found: " + path);
            }
            if (code == 429) {
                log.warn("{} rate limited the request to {}", source, path);
                throw new RateLimitedException(source);
            }
            if (code >= 400) {
                log.error("{} returned HTTP {} for {}", source, code, path);
                throw new UpstreamException(source, code, source + " returned HTTP " + code);
            }
            log.debug("{} responded {} for {}", source, code, path);
            return response.body() != null ? response.body().string() : "{}";
        } catch (InterruptedIOException e) {
            // SocketTimeoutException and OkHttp's call timeout both land here
            log.error("{} timed out calling {}", source, path);
            throw new SourceTimeoutException(source, source + " request timed out", e);
        } catch (IOException e) {
            log.error("{} HTTP failure calling {}: {}", source, path, e.getMessage());
            throw new UpstreamException(source, 0, source + " HTTP failure: " + e.getMessage(), e);
        }
    }
}
