package org.transparentclassroom.client.rest.service;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transparentclassroom.client.rest.exception.ApiRequestException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Executes HTTP requests against the API and returns response bodies.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Execute HTTP requests</li>
 *   <li>Log request/response details for debugging (credentials masked)</li>
 *   <li>Validate response status codes</li>
 *   <li>Extract response body as string</li>
 * </ul>
 *
 * <p><b>Success criteria:</b> HTTP status codes 200-299</p>
 *
 * <p><b>Note:</b> Uses a shared HttpClient instance for connection pooling.</p>
 */
public class HttpRequestExecutor {

    private static final Logger logger = LoggerFactory.getLogger(HttpRequestExecutor.class);

    /**
     * Shared HttpClient instance for connection pooling and reuse.
     */
    private static final CloseableHttpClient SHARED_HTTP_CLIENT = HttpClientBuilder.create().build();

    /**
     * Executes an HTTP request and returns the response body as string.
     *
     * @param request Configured HTTP request to execute
     * @return Response body as UTF-8 string
     * @throws ApiRequestException If the response status is not successful
     * @throws IOException If request execution fails
     */
    public String executeRequest(HttpUriRequestBase request) throws IOException {
        if (logger.isDebugEnabled()) {
            logRequest(request);
        }

        return SHARED_HTTP_CLIENT.execute(request, response -> {
            int statusCode = response.getCode();

            if (logger.isDebugEnabled()) {
                logResponse(response, statusCode);
            }

            if (!isSuccessfulResponse(statusCode)) {
                throw new ApiRequestException("Request " + request.getMethod() + " " + request.getRequestUri()
                        + " failed, status code (" + statusCode + ")", statusCode);
            }

            HttpEntity entity = response.getEntity();
            if (entity == null) {
                throw new IOException("Empty response entity");
            }

            try (InputStream is = entity.getContent()) {
                String responseBody = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                if (logger.isTraceEnabled()) {
                    logger.trace("Response Body:");
                    logger.trace("{}", responseBody);
                }
                return responseBody;
            }
        });
    }

    /**
     * Checks if HTTP status code indicates success (200-299).
     */
    private boolean isSuccessfulResponse(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private void logRequest(HttpUriRequestBase request) {
        logger.debug("=== HTTP REQUEST ===");
        logger.debug("Method: {}", request.getMethod());
        logger.debug("URI: {}", request.getRequestUri());
        logger.debug("Headers:");
        for (Header header : request.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), isSecret(header.getName()) ? "****" : header.getValue());
        }
    }

    private void logResponse(HttpResponse response, int statusCode) {
        logger.debug("=== HTTP RESPONSE ===");
        logger.debug("Status Code: {}", statusCode);
        logger.debug("Response Headers:");
        for (Header header : response.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), header.getValue());
        }
    }

    private static boolean isSecret(String headerName) {
        return HttpHeaders.AUTHORIZATION.equalsIgnoreCase(headerName)
                || HttpRequestBuilder.TOKEN_HEADER.equalsIgnoreCase(headerName);
    }
}
