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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.exception.StepExecutionException;
import me.golemcore.toolrouter.domain.model.CancellationToken;
import me.golemcore.toolrouter.domain.model.EnrichedExecutionStep;
import me.golemcore.toolrouter.domain.model.HostCredentials;
import me.golemcore.toolrouter.domain.model.StepResult;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.BackendAdapterPort;
import me.golemcore.toolrouter.port.outbound.CredentialResolverPort;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * Runs a read-only SQL query over JDBC and returns the rows as a JSON array.
 * Location key {@code database}.
 *
 * <p>
 * Understood {@code protocolMetadata} keys:
 * <ul>
 * <li>{@code query} - SQL with {@code ?} placeholders (required)
 * <li>{@code parameters} - input names bound to the placeholders, in order
 * <li>{@code url} - JDBC URL template, overriding
 * {@code toolrouter.backends.database.url}; {@code {{targetHost}}} is
 * available in both
 * </ul>
 *
 * <p>
 * Only queries are accepted; the connection is opened read-only and the
 * statement is cancelled when the step is.
 */
@Component
@Slf4j
public class JdbcBackendAdapter implements BackendAdapterPort {

    private static final Set<String> READ_ONLY_KEYWORDS = Set.of("SELECT", "WITH", "SHOW", "EXPLAIN", "VALUES");

    private final ToolRouterProperties.DatabaseProperties config;
    private final CredentialResolverPort credentialResolver;
    private final ObjectMapper objectMapper;

    public JdbcBackendAdapter(ToolRouterProperties properties, CredentialResolverPort credentialResolver,
            ObjectMapper objectMapper) {
        this.config = properties.getBackends().getDatabase();
        this.credentialResolver = credentialResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getLocation() {
        return "database";
    }

    @Override
    public StepResult execute(EnrichedExecutionStep step, CancellationToken cancellation) {
        String query = StepTemplates.requiredString(step, "query").trim().replaceAll(";+\\s*$", "");
        requireReadOnly(query);
        String url = jdbcUrl(step);
        List<Object> parameters = parameterValues(step);

        Properties info = new Properties();
        Optional<HostCredentials> credentials = BackendCredentials.forStep(credentialResolver, step);
        credentials.ifPresent(c -> {
            if (c.username() != null) {
                info.setProperty("user", c.username());
            }
            if (c.hasPassword()) {
                info.setProperty("password", c.password());
            }
        });

        log.debug("[JDBC] Step {}: {} parameter(s)", step.getId(), parameters.size());
        try (Connection connection = DriverManager.getConnection(url, info)) {
            connection.setReadOnly(true);
            try (PreparedStatement statement = connection.prepareStatement(query)) {
                statement.setMaxRows(config.getMaxRows());
                if (step.getTimeoutMs() != null && step.getTimeoutMs() > 0) {
                    statement.setQueryTimeout((int) Math.max(1, (step.getTimeoutMs() + 999) / 1000));
                }
                for (int i = 0; i < parameters.size(); i++) {
                    statement.setObject(i + 1, parameters.get(i));
                }
                cancellation.onCancel(() -> cancelQuietly(statement));
                try (ResultSet rows = statement.executeQuery()) {
                    List<Map<String, Object>> result = readRows(rows);
                    return StepResult.success(objectMapper.writeValueAsString(result));
                }
            }
        } catch (SQLException e) {
            if (cancellation.isCancelled()) {
                throw new StepExecutionException("Query cancelled", e);
            }
            throw new StepExecutionException("Query failed: " + e.getMessage(), e.getErrorCode(), null, e);
        } catch (JsonProcessingException e) {
            throw new StepExecutionException("Cannot serialize query result: " + e.getMessage(), e);
        }
    }

    static void requireReadOnly(String query) {
        String firstWord = query.split("\\s+", 2)[0].toUpperCase(Locale.ROOT);
        if (!READ_ONLY_KEYWORDS.contains(firstWord) || query.contains(";")) {
            throw new StepExecutionException("Only single read-only queries are allowed, got: " + firstWord);
        }
    }

    private String jdbcUrl(EnrichedExecutionStep step) {
        String template = StepTemplates.optionalString(step, "url");
        if (template == null) {
            template = config.getUrl();
        }
        if (template == null || template.isBlank()) {
            throw new StepExecutionException("No JDBC URL: set protocolMetadata.url or toolrouter.backends.database.url");
        }
        return StepTemplates.render(template, step);
    }

    private static List<Object> parameterValues(EnrichedExecutionStep step) {
        List<Object> values = new ArrayList<>();
        for (String name : StepTemplates.optionalList(step, "parameters")) {
            if (!step.getInputs().containsKey(name)) {
                throw new StepExecutionException("Step " + step.getId() + " has no input '" + name + "'");
            }
            values.add(step.getInputs().get(name));
        }
        return values;
    }

    private static List<Map<String, Object>> readRows(ResultSet rows) throws SQLException {
        ResultSetMetaData meta = rows.getMetaData();
        int columns = meta.getColumnCount();
        List<Map<String, Object>> result = new ArrayList<>();
        while (rows.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columns; i++) {
                Object value = rows.getObject(i);
                row.put(meta.getColumnLabel(i), value instanceof Number || value instanceof Boolean || value == null
                        ? value
                        : value.toString());
            }
            result.add(row);
        }
        return result;
    }

    private static void cancelQuietly(PreparedStatement statement) {
        try {
            statement.cancel();
        } catch (SQLException e) {
            log.warn("[JDBC] Failed to cancel statement: {}", e.getMessage());
        }
    }
}
