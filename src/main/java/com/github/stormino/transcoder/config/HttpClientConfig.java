package com.github.stormino.transcoder.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final TranscoderProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        TranscoderProperties.Catalogue catalogue = properties.getCatalogue();
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(catalogue.getTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(catalogue.getTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(catalogue.getTimeoutSeconds()))
                .addInterceptor(new BrowserHeadersInterceptor(catalogue.getUserAgent()))
                .addInterceptor(new RetryInterceptor(catalogue.getMaxRetries(), catalogue.getRetryDelayMs()))
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
    }

    /**
     * Sends the headers the catalogue and CDN hosts expect from a browser.
     */
    static class BrowserHeadersInterceptor implements Interceptor {

        private final String userAgent;

        BrowserHeadersInterceptor(String userAgent) {
            this.userAgent = userAgent;
        }

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            Request original = chain.request();
            Request.Builder builder = original.newBuilder()
                    .header("User-Agent", userAgent)
                    .header("Accept-Language", "en-US,en;q=0.5");
            if (original.header("Accept") == null) {
                builder.header("Accept", "*/*");
            }

            Response response = chain.proceed(builder.build());

            if (response.code() == 403 || response.code() == 503) {
                String body = response.peekBody(1024).string();
                if (body.contains("cloudflare") || body.contains("cf-browser-verification")) {
                    log.warn("Cloudflare challenge detected on {}", original.url());
                }
            }

            return response;
        }
    }

    /**
     * Retries 5xx responses and network errors with exponential backoff.
     */
    static class RetryInterceptor implements Interceptor {

        private final int maxRetries;
        private final long retryDelayMs;

        RetryInterceptor(int maxRetries, long retryDelayMs) {
            this.maxRetries = maxRetries;
            this.retryDelayMs = retryDelayMs;
        }

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            Request request = chain.request();
            IOException lastFailure = null;

            for (int attempt = 1; attempt <= maxRetries; attempt++) {
                boolean lastAttempt = attempt == maxRetries;
                try {
                    Response response = chain.proceed(request);
                    if (response.code() < 500 || lastAttempt) {
                        return response;
                    }
                    log.debug("HTTP {} from {} (attempt {}/{})", response.code(), request.url(), attempt, maxRetries);
                    response.close();
                } catch (IOException e) {
                    lastFailure = e;
                    log.warn("Request to {} failed (attempt {}/{}): {}", request.url(), attempt, maxRetries, e.getMessage());
                    if (lastAttempt) {
                        break;
                    }
                }
                backOff(attempt);
            }

            throw lastFailure != null ? lastFailure : new IOException("No attempt made for " + request.url());
        }

        private void backOff(int attempt) throws IOException {
            try {
                TimeUnit.MILLISECONDS.sleep(retryDelayMs << (attempt - 1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting to retry", e);
            }
        }
    }
}
