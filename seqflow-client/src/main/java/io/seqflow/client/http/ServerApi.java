package io.seqflow.client.http;

import io.seqflow.client.SeqflowClientConfig;
import io.seqflow.core.exception.ServerApiException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Thin HTTP layer over `java.net.http` for the workflow server's JSON API.
///
/// Every method sends exactly one request and returns the raw response; status handling
/// belongs to the caller. Paths are appended to the configured server URL.
///
/// ### Contracts
/// - **Postcondition**: a returned response was received from the server
/// - transport failures surface as {@link ServerApiException}; an interrupt restores the
///   thread's interrupt flag before throwing
///
/// @implNote Thread-safe. One `HttpClient` is shared by all requests of a client instance.
public class ServerApi {

    private static final Logger LOG = LoggerFactory.getLogger(ServerApi.class);

    static final String APPLICATION_JSON = "application/json";
    static final String TEXT_EVENT_STREAM = "text/event-stream";

    private final SeqflowClientConfig config;
    private final HttpClient httpClient;

    /// Creates an API bound to the configured server with a dedicated `HttpClient`.
    ///
    /// @param config client configuration, not null
    public ServerApi(SeqflowClientConfig config) {
        this(
                config,
                HttpClient.newBuilder()
                        .connectTimeout(config.getConnectTimeout())
                        .version(HttpClient.Version.HTTP_1_1)
                        .build());
    }

    /// Creates an API over a caller-supplied `HttpClient`.
    ///
    /// @param config client configuration, not null
    /// @param httpClient client used for all requests, not null
    public ServerApi(SeqflowClientConfig config, HttpClient httpClient) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    /// Sends an HTTP GET request accepting JSON.
    ///
    /// @param path API path (e.g., "/api/v1/agents"), not null
    /// @return HTTP response, never null
    /// @throws ServerApiException if the request fails
    public HttpResponse<String> get(String path) {
        HttpRequest request =
                newRequest(path).GET().header("Accept", APPLICATION_JSON).build();
        return send(request, HttpResponse.BodyHandlers.ofString());
    }

    /// Sends an HTTP POST request with a JSON body, accepting JSON.
    ///
    /// @param path API path, not null
    /// @param jsonBody JSON request body, not null
    /// @return HTTP response, never null
    /// @throws ServerApiException if the request fails
    public HttpResponse<String> post(String path, String jsonBody) {
        HttpRequest request =
                newRequest(path)
                        .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                        .header("Content-Type", APPLICATION_JSON)
                        .header("Accept", APPLICATION_JSON)
                        .build();
        return send(request, HttpResponse.BodyHandlers.ofString());
    }

    /// Sends an HTTP DELETE request.
    ///
    /// @param path API path, not null
    /// @return HTTP response, never null
    /// @throws ServerApiException if the request fails
    public HttpResponse<String> delete(String path) {
        HttpRequest request = newRequest(path).DELETE().build();
        return send(request, HttpResponse.BodyHandlers.ofString());
    }

    /// Sends an HTTP POST request asking for a Server-Sent-Events response.
    ///
    /// The body is returned unread as soon as the headers arrive; the caller owns the
    /// stream and must close it. Servers may ignore the `Accept` header and answer with
    /// plain JSON, so callers should check the content type.
    ///
    /// @param path API path, not null
    /// @param jsonBody JSON request body, not null
    /// @return HTTP response with an open body stream, never null
    /// @throws ServerApiException if the request fails before headers are received
    public HttpResponse<InputStream> postForStream(String path, String jsonBody) {
        HttpRequest request =
                newRequest(path)
                        .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                        .header("Content-Type", APPLICATION_JSON)
                        .header("Accept", TEXT_EVENT_STREAM)
                        .header("Cache-Control", "no-cache")
                        .build();
        return send(request, HttpResponse.BodyHandlers.ofInputStream());
    }

    public SeqflowClientConfig getConfig() {
        return config;
    }

    private HttpRequest.Builder newRequest(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.getServerUrl() + path))
                .timeout(config.getRequestTimeout());
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        LOG.debug("{} {}", request.method(), request.uri());
        try {
            HttpResponse<T> response = httpClient.send(request, handler);
            LOG.debug("{} {} -> {}", request.method(), request.uri(), response.statusCode());
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServerApiException("Request interrupted: " + request.uri(), e);
        } catch (IOException e) {
            throw new ServerApiException(
                    "Failed to reach server at "
                            + config.getServerUrl()
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }
}
