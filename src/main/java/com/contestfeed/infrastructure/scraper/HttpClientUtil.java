package com.contestfeed.infrastructure.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.net.URIBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Map;

/**
 * Utility for making JSON GET requests to the scoreboard provider.
 */
public class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private HttpClientUtil() {
    }

    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.error("Response body preview: {}", preview);
    }

    /**
     * Makes a GET request with query parameters and returns the response as JsonNode.
     *
     * @param timeout applied to connecting and to waiting for the response
     * @throws IOException on transport failure, non-2xx status or a non-JSON body
     */
    public static JsonNode getJson(String baseUrl, Map<String, String> params, Map<String, String> headers,
                                   Duration timeout) throws IOException {
        String url = buildUrl(baseUrl, params);
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofMilliseconds(timeout.toMillis()))
            .setResponseTimeout(Timeout.ofMilliseconds(timeout.toMillis()))
            .build();

        try (CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                    .setDefaultConnectionConfig(connectionConfig(timeout))
                    .build())
                .setDefaultRequestConfig(requestConfig)
                .build()) {
            HttpGet request = new HttpGet(url);
            if (headers != null) {
                headers.forEach(request::addHeader);
            }

            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getCode();
                HttpEntity entity = response.getEntity();
                String contentType = entity != null ? entity.getContentType() : null;

                String responseBody;
                try {
                    responseBody = entity != null ? EntityUtils.toString(entity) : "";
                } catch (ParseException e) {
                    throw new IOException("Failed to parse response", e);
                }

                if (statusCode < 200 || statusCode >= 300) {
                    logger.error("HTTP request failed with status {}: {}", statusCode, url);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("HTTP request failed with status " + statusCode);
                }

                // A missing content type is still parsed as JSON
                if (contentType != null && !contentType.isEmpty()
                    && !contentType.toLowerCase().startsWith("application/json")) {
                    logger.error("Expected JSON but received content-type: {}. URL: {}", contentType, url);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("Expected JSON response but received: " + contentType);
                }

                try {
                    return objectMapper.readTree(responseBody);
                } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
                    logger.error("Failed to parse JSON. URL: {}", url);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("Failed to parse JSON response: " + e.getOriginalMessage(), e);
                }
            }
        }
    }

    static ConnectionConfig connectionConfig(Duration timeout) {
        return ConnectionConfig.custom()
            .setConnectTimeout(Timeout.ofMilliseconds(timeout.toMillis()))
            .setSocketTimeout(Timeout.ofMilliseconds(timeout.toMillis()))
            .build();
    }

    static String buildUrl(String baseUrl, Map<String, String> params) throws IOException {
        try {
            URIBuilder builder = new URIBuilder(baseUrl);
            if (params != null) {
                params.forEach(builder::addParameter);
            }
            return builder.build().toString();
        } catch (URISyntaxException e) {
            throw new IOException("Invalid URL: " + baseUrl, e);
        }
    }
}
