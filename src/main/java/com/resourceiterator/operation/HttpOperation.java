package com.resourceiterator.operation;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * An {@link Operation} that sends its parameters as the query string of an HTTP GET and decodes
 * the JSON body into a {@link JsonResponseDocument}.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpOperation listOrders = new HttpOperation("ListOrders", "https://api.example.com/orders");
 * listOrders.set("MaxItems", 50);
 *
 * ResourceIterator<Object> orders = factory.build(listOrders, IteratorOptions.defaults());
 * }</pre>
 *
 * <p>Values appended to the {@value #USER_AGENT_OPTION} option are added to the
 * {@code User-Agent} header, separated by spaces. Failures are not retried: I/O errors and
 * HTTP error statuses are thrown from {@link #execute()} as {@link UncheckedIOException}.
 */
public class HttpOperation extends AbstractOperation {

    static final String USER_AGENT = "resource-iterators/1.0";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;

    /**
     * Creates an operation with a default client and mapper.
     *
     * @param name the operation name
     * @param baseUrl the endpoint URL, which may already carry a query string
     */
    public HttpOperation(String name, String baseUrl) {
        this(
                name,
                baseUrl,
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                new ObjectMapper(),
                Duration.ofSeconds(30)
        );
    }

    /**
     * Creates an operation with a pre-configured HttpClient and ObjectMapper.
     */
    public HttpOperation(
            String name,
            String baseUrl,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            Duration requestTimeout
    ) {
        super(name);
        this.baseUrl = baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    private HttpOperation(HttpOperation source) {
        super(source);
        this.baseUrl = source.baseUrl;
        this.httpClient = source.httpClient;
        this.objectMapper = source.objectMapper;
        this.requestTimeout = source.requestTimeout;
    }

    @Override
    public HttpOperation copy() {
        return new HttpOperation(this);
    }

    @Override
    public ResponseDocument execute() {
        try {
            return doExecute(buildUri());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to execute " + getName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while executing " + getName(), e);
        }
    }

    URI buildUri() {
        Map<String, Object> params = getParams();
        if (params.isEmpty()) {
            return URI.create(baseUrl);
        }

        String query = params.entrySet().stream()
                .map(entry -> encode(entry.getKey()) + "=" + encode(String.valueOf(entry.getValue())))
                .collect(Collectors.joining("&"));
        return URI.create(baseUrl + (baseUrl.contains("?") ? "&" : "?") + query);
    }

    String userAgent() {
        List<Object> appended = getOption(USER_AGENT_OPTION);
        if (appended.isEmpty()) {
            return USER_AGENT;
        }
        return USER_AGENT + " " + appended.stream()
                .map(String::valueOf)
                .distinct()
                .collect(Collectors.joining(" "));
    }

    private ResponseDocument doExecute(URI uri) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", "application/json")
                .header("User-Agent", userAgent())
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<InputStream> response = httpClient.send(
                request,
                HttpResponse.BodyHandlers.ofInputStream()
        );

        try (InputStream body = response.body()) {
            int statusCode = response.statusCode();
            if (statusCode >= 400) {
                throw new HttpException(statusCode, "HTTP error " + statusCode + " from " + uri);
            }
            return JsonResponseDocument.read(body, objectMapper);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Exception thrown when the server answers with an error status.
     */
    public static class HttpException extends IOException {
        private final int statusCode;

        public HttpException(int statusCode, String message) {
            super(message);
            this.statusCode = statusCode;
        }

        public int getStatusCode() {
            return statusCode;
        }
    }
}
