package dev.evalkit.target;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.evalkit.config.EvalkitConfig;
import dev.evalkit.json.EvalkitJsonMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/** Invokes {@link TargetConfig.Api} targets over HTTP. */
@Slf4j
public class HttpTargetInvoker implements TargetInvoker {
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpTargetInvoker(EvalkitConfig config) {
        this(config, createDefaultHttpClient(config));
    }

    HttpTargetInvoker(EvalkitConfig config, HttpClient httpClient) {
        this.httpClient = httpClient;
        this.objectMapper = EvalkitJsonMapper.get();
        this.requestTimeout = config.targetRequestTimeout();
    }

    @Override
    public String invoke(TargetConfig config, Map<String, String> inputFields) {
        if (!(config instanceof TargetConfig.Api api)) {
            throw new TargetInvocationException(
                    "http invoker cannot handle target type " + config.kind().wireName());
        }
        var body = buildBody(api, inputFields);
        var request = buildRequest(api, body);
        log.debug("Target Request: {} {}", request.method(), request.uri());
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return handleResponse(api, response);
        } catch (IOException e) {
            throw new TargetInvocationException(
                    "Request to %s (method: %s) failed: %s"
                            .formatted(api.url(), api.method(), e.getMessage()),
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TargetInvocationException("Interrupted calling " + api.url(), e);
        }
    }

    static Map<String, Object> buildBody(TargetConfig.Api api, Map<String, String> inputFields) {
        var body = new LinkedHashMap<String, Object>();
        if (api.inputMapping().isEmpty()) {
            body.putAll(inputFields);
        } else {
            api.inputMapping()
                    .forEach(
                            (requestKey, fieldName) -> {
                                if (inputFields.containsKey(fieldName)) {
                                    body.put(requestKey, inputFields.get(fieldName));
                                }
                            });
        }
        api.bodyTemplate()
                .forEach(
                        (key, value) -> {
                            if (value instanceof String s
                                    && s.length() > 1
                                    && s.startsWith("{")
                                    && s.endsWith("}")) {
                                var placeholder = s.substring(1, s.length() - 1);
                                if (body.containsKey(placeholder)) {
                                    body.put(key, body.get(placeholder));
                                }
                            } else if (!body.containsKey(key)) {
                                body.put(key, value);
                            }
                        });
        return body;
    }

    private HttpRequest buildRequest(TargetConfig.Api api, Map<String, Object> body) {
        var method = api.method().toUpperCase(Locale.ROOT);
        var builder = HttpRequest.newBuilder().timeout(requestTimeout);
        api.headers().forEach(builder::header);
        switch (method) {
            case "GET" -> builder.uri(URI.create(withQuery(api.url(), body))).GET();
            case "POST", "PUT", "PATCH" -> builder.uri(URI.create(api.url()))
                    .header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(toJson(body)));
            default -> throw new TargetInvocationException("Unsupported HTTP method: " + method);
        }
        return builder.build();
    }

    private String handleResponse(TargetConfig.Api api, HttpResponse<String> response) {
        log.debug("Target Response: {} - {}", response.statusCode(), response.body());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new TargetInvocationException(
                    "HTTP error: %s returned status %d: %s"
                            .formatted(api.url(), response.statusCode(), response.body()));
        }
        var contentType = response.headers().firstValue("Content-Type").orElse("");
        var responseBody = response.body() == null ? "" : response.body();
        if (!contentType.startsWith("application/json")) {
            return responseBody;
        }
        try {
            var node = objectMapper.readTree(responseBody);
            return node != null && node.isTextual() ? node.asText() : responseBody;
        } catch (JsonProcessingException e) {
            log.warn("target {} declared json but returned unparseable body", api.url());
            return responseBody;
        }
    }

    private String toJson(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TargetInvocationException("Failed to serialize request body", e);
        }
    }

    private static String withQuery(String url, Map<String, Object> params) {
        if (params.isEmpty()) {
            return url;
        }
        var query =
                params.entrySet().stream()
                        .map(
                                entry ->
                                        URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                                                + "="
                                                + URLEncoder.encode(
                                                        String.valueOf(entry.getValue()),
                                                        StandardCharsets.UTF_8))
                        .collect(Collectors.joining("&"));
        return url + (url.contains("?") ? "&" : "?") + query;
    }

    private static HttpClient createDefaultHttpClient(EvalkitConfig config) {
        return HttpClient.newBuilder().connectTimeout(config.targetConnectTimeout()).build();
    }
}
