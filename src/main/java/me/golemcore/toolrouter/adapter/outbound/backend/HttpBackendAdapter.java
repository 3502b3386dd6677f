package me.golemcore.toolrouter.adapter.outbound.backend;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.exception.StepExecutionException;
import me.golemcore.toolrouter.domain.model.CancellationToken;
import me.golemcore.toolrouter.domain.model.EnrichedExecutionStep;
import me.golemcore.toolrouter.domain.model.HostCredentials;
import me.golemcore.toolrouter.domain.model.StepResult;
import me.golemcore.toolrouter.domain.model.StepStatus;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.BackendAdapterPort;
import me.golemcore.toolrouter.port.outbound.CredentialResolverPort;
import okhttp3.Call;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Executes a step as one HTTP request through the shared OkHttp client.
 * Location key {@code http}.
 *
 * <p>
 * Understood {@code protocolMetadata} keys:
 * <ul>
 * <li>{@code url} - absolute URL template; or
 * <li>{@code path} - path template resolved against
 * {@code toolrouter.backends.http.base-url}, else {@code http://<targetHost>}
 * <li>{@code method} - defaults to GET
 * <li>{@code headers} - map of header templates
 * <li>{@code body} - request body template
 * <li>{@code contentType} - defaults to application/json
 * </ul>
 *
 * <p>
 * Any 2xx response succeeds. A numeric {@value #COST_HEADER} response header
 * is reported as the step's observed cost. Host credentials, when required,
 * are sent as HTTP Basic authentication.
 */
@Component
@Slf4j
public class HttpBackendAdapter implements BackendAdapterPort {

    static final String COST_HEADER = "X-Observed-Cost";
    private static final String DEFAULT_CONTENT_TYPE = "application/json";
    private static final int MAX_OUTPUT_CHARS = 100_000;
    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");

    private final OkHttpClient httpClient;
    private final ToolRouterProperties.HttpBackendProperties config;
    private final CredentialResolverPort credentialResolver;

    public HttpBackendAdapter(OkHttpClient httpClient, ToolRouterProperties properties,
            CredentialResolverPort credentialResolver) {
        this.httpClient = httpClient;
        this.config = properties.getBackends().getHttp();
        this.credentialResolver = credentialResolver;
    }

    @Override
    public String getLocation() {
        return "http";
    }

    @Override
    public StepResult execute(EnrichedExecutionStep step, CancellationToken cancellation) {
        Request request = buildRequest(step);
        Call call = httpClient.newCall(request);
        if (step.getTimeoutMs() != null && step.getTimeoutMs() > 0) {
            call.timeout().timeout(step.getTimeoutMs(), TimeUnit.MILLISECONDS);
        }
        cancellation.onCancel(call::cancel);
        log.debug("[HTTP] Step {}: {} {}", step.getId(), request.method(), request.url().redact());

        try (Response response = call.execute()) {
            ResponseBody responseBody = response.body();
            String body = StepTemplates.truncate(responseBody != null ? responseBody.string() : "", MAX_OUTPUT_CHARS);
            if (!response.isSuccessful()) {
                throw new StepExecutionException("HTTP " + response.code() + " from " + request.url().redact(),
                        response.code(), body, null);
            }
            return StepResult.builder()
                    .status(StepStatus.SUCCEEDED)
                    .output(body)
                    .exitCode(response.code())
                    .observedCost(parseCost(response.header(COST_HEADER)))
                    .build();
        } catch (IOException e) {
            if (call.isCanceled()) {
                throw new StepExecutionException("HTTP call cancelled", e);
            }
            throw new StepExecutionException("HTTP call failed: " + e.getMessage(), e);
        }
    }

    Request buildRequest(EnrichedExecutionStep step) {
        HttpUrl url = HttpUrl.parse(resolveUrl(step));
        if (url == null) {
            throw new StepExecutionException("Invalid URL for step " + step.getId());
        }
        String method = StepTemplates.optionalString(step, "method");
        method = method != null ? method.toUpperCase(Locale.ROOT) : "GET";

        RequestBody body = null;
        String bodyTemplate = StepTemplates.optionalString(step, "body");
        if (bodyTemplate != null || BODY_METHODS.contains(method)) {
            String contentType = StepTemplates.optionalString(step, "contentType");
            body = RequestBody.create(bodyTemplate != null ? StepTemplates.render(bodyTemplate, step) : "",
                    MediaType.parse(contentType != null ? contentType : DEFAULT_CONTENT_TYPE));
        }

        Request.Builder builder = new Request.Builder().url(url).method(method, body);
        StepTemplates.optionalMap(step, "headers")
                .forEach((name, value) -> builder.header(name, StepTemplates.render(String.valueOf(value), step)));
        BackendCredentials.forStep(credentialResolver, step).ifPresent(credentials -> builder
                .header("Authorization", basicAuth(credentials)));
        return builder.build();
    }

    private String resolveUrl(EnrichedExecutionStep step) {
        String url = StepTemplates.optionalString(step, "url");
        if (url != null) {
            return StepTemplates.render(url, step);
        }
        String path = StepTemplates.render(StepTemplates.requiredString(step, "path"), step);
        String base = config.getBaseUrl();
        if (base == null || base.isBlank()) {
            if (step.getTargetHost() == null || step.getTargetHost().isBlank()) {
                throw new StepExecutionException("HTTP step " + step.getId()
                        + " has neither a url, a configured base-url nor a targetHost");
            }
            base = "http://" + step.getTargetHost();
        }
        if (base.endsWith("/") && path.startsWith("/")) {
            return base + path.substring(1);
        }
        return base.endsWith("/") || path.startsWith("/") ? base + path : base + "/" + path;
    }

    private static String basicAuth(HostCredentials credentials) {
        if (credentials.username() == null || !credentials.hasPassword()) {
            throw new StepExecutionException("HTTP credentials for " + credentials.host()
                    + " need both username and password");
        }
        return Credentials.basic(credentials.username(), credentials.password());
    }

    private static Double parseCost(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(header.trim());
        } catch (NumberFormatException e) {
            log.debug("[HTTP] Ignoring non-numeric {} header: {}", COST_HEADER, header);
            return null;
        }
    }
}
