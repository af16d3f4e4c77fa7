package org.transparentclassroom.client.rest.service;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.net.URIBuilder;
import org.transparentclassroom.client.rest.config.ClientSettings;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Builds HTTP requests for the Transparent Classroom API.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Resolve relative routes against the configured host</li>
 *   <li>Encode query parameters (null values are skipped)</li>
 *   <li>Configure request timeouts</li>
 *   <li>Add the session headers, or basic credentials when authenticating</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * HttpRequestBuilder builder = new HttpRequestBuilder(settings);
 * HttpGet request = builder.buildRequest(Route.LIST.render(EntityKind.CHILD), parameters, apiToken);
 * }</pre>
 */
public class HttpRequestBuilder {

    public static final String TOKEN_HEADER = "X-TransparentClassroomToken";
    public static final String MASQUERADE_HEADER = "X-TransparentClassroomMasqueradeId";
    public static final String SCHOOL_HEADER = "X-TransparentClassroomSchoolId";

    private final ClientSettings settings;

    public HttpRequestBuilder(ClientSettings settings) {
        this.settings = settings;
    }

    /**
     * Builds an authenticated GET request.
     *
     * @param route      Relative URL (e.g. {@code api/v1/children.json})
     * @param parameters Query parameters; null values are skipped
     * @param apiToken   Session token from authentication
     * @return configured request
     */
    public HttpGet buildRequest(String route, Map<String, ?> parameters, String apiToken) {
        HttpGet request = new HttpGet(buildUri(route, parameters));
        configure(request);
        if (apiToken != null) {
            request.setHeader(TOKEN_HEADER, apiToken);
        }
        if (settings.getMasqueradeId() != null) {
            request.setHeader(MASQUERADE_HEADER, String.valueOf(settings.getMasqueradeId()));
        }
        if (settings.getSchoolId() != null) {
            request.setHeader(SCHOOL_HEADER, String.valueOf(settings.getSchoolId()));
        }
        return request;
    }

    /**
     * Builds the authentication request, sending the configured email and password as
     * HTTP basic credentials.
     *
     * @param route Relative URL of the authentication endpoint
     * @return configured request
     */
    public HttpGet buildAuthenticateRequest(String route) {
        HttpGet request = new HttpGet(buildUri(route, null));
        configure(request);
        String credentials = settings.getEmail() + ":" + settings.getPassword();
        request.setHeader(HttpHeaders.AUTHORIZATION,
                "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        if (settings.getSchoolId() != null) {
            request.setHeader(SCHOOL_HEADER, String.valueOf(settings.getSchoolId()));
        }
        return request;
    }

    private String buildUri(String route, Map<String, ?> parameters) {
        try {
            URIBuilder builder = new URIBuilder(settings.getHost() + "/" + route);
            if (parameters != null) {
                for (Map.Entry<String, ?> parameter : parameters.entrySet()) {
                    addParameter(builder, parameter.getKey(), parameter.getValue());
                }
            }
            return builder.build().toString();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid request URI for route " + route, e);
        }
    }

    private static void addParameter(URIBuilder builder, String name, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Collection) {
            for (Object element : (Collection<?>) value) {
                if (element != null) {
                    builder.addParameter(name + "[]", format(element));
                }
            }
            return;
        }
        builder.addParameter(name, format(value));
    }

    private static String format(Object value) {
        if (value instanceof LocalDate) {
            return ((LocalDate) value).format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        return String.valueOf(value);
    }

    private void configure(HttpGet request) {
        request.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(settings.getConnectionTimeout(), TimeUnit.SECONDS)
                .setResponseTimeout(settings.getResponseTimeout(), TimeUnit.SECONDS)
                .build());
    }
}
