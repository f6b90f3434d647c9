package com.example.archiveindexer.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Sends keyed JSON POSTs to the search-reindex and cache-invalidation endpoints.
 */
public final class HttpBuildNotifier implements BuildNotifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpBuildNotifier.class);
    static final int MAX_URLS_PER_REQUEST = 16;

    private final String searchReindexUrl;
    private final String cacheInvalidationUrl;
    private final String keyHeader;
    private final String key;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @param searchReindexUrl     endpoint for reindex requests, or {@code null} to skip them
     * @param cacheInvalidationUrl endpoint for purge requests, or {@code null} to skip them
     * @param keyHeader            name of the header carrying the key
     * @param key                  secret sent in {@code keyHeader}, may be {@code null}
     */
    public HttpBuildNotifier(String searchReindexUrl,
                             String cacheInvalidationUrl,
                             String keyHeader,
                             String key,
                             Duration timeout) {
        this.searchReindexUrl = searchReindexUrl;
        this.cacheInvalidationUrl = cacheInvalidationUrl;
        this.keyHeader = keyHeader;
        this.key = key;
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .setResponseTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .build();
        this.httpClient = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    @Override
    public void requestSearchReindex() {
        if (searchReindexUrl == null) {
            LOGGER.debug("No search reindex URL configured; skipping");
            return;
        }
        post(searchReindexUrl, Map.of());
    }

    @Override
    public void invalidateCachedUrls(List<String> urls) {
        if (cacheInvalidationUrl == null || urls.isEmpty()) {
            LOGGER.debug("No cache invalidation URL configured or nothing to purge; skipping");
            return;
        }
        for (int start = 0; start < urls.size(); start += MAX_URLS_PER_REQUEST) {
            List<String> batch = urls.subList(start, Math.min(urls.size(), start + MAX_URLS_PER_REQUEST));
            post(cacheInvalidationUrl, Map.of("files", batch));
        }
    }

    private void post(String url, Map<String, Object> body) {
        HttpPost request = new HttpPost(url);
        if (key != null && !key.isEmpty()) {
            request.setHeader(keyHeader, key);
        }
        try {
            request.setEntity(new StringEntity(mapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int status = response.getCode();
                EntityUtils.consume(response.getEntity());
                if (status >= 200 && status < 300) {
                    LOGGER.info("Notified {} (HTTP {})", url, status);
                } else {
                    LOGGER.warn("Notification to {} returned HTTP {}", url, status);
                }
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed to notify {}", url, ex);
        }
    }

    @Override
    public void close() {
        try {
            httpClient.close();
        } catch (IOException ex) {
            LOGGER.warn("Failed to close HTTP client", ex);
        }
    }
}
