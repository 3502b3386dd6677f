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
import me.golemcore.toolrouter.domain.model.StepResult;
import me.golemcore.toolrouter.port.outbound.BackendAdapterPort;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs steps as local OS processes. Location key {@code local}.
 *
 * <p>
 * Understood {@code protocolMetadata} keys:
 * <ul>
 * <li>{@code argv} - command and arguments, each rendered from the inputs
 * <li>{@code command} - shell command line, used when {@code argv} is absent;
 * input values are shell-quoted
 * <li>{@code workingDirectory} - optional
 * <li>{@code env} - optional map of extra environment variables
 * </ul>
 */
@Component
@Slf4j
public class LocalProcessBackendAdapter implements BackendAdapterPort {

    @Override
    public String getLocation() {
        return "local";
    }

    @Override
    public StepResult execute(EnrichedExecutionStep step, CancellationToken cancellation) {
        List<String> command = buildCommand(step);
        String workingDirectory = StepTemplates.optionalString(step, "workingDirectory");
        Map<String, String> env = new LinkedHashMap<>();
        StepTemplates.optionalMap(step, "env")
                .forEach((key, value) -> env.put(key, StepTemplates.render(String.valueOf(value), step)));

        log.debug("[Local] Step {}: {}", step.getId(), command.get(0));
        return ProcessRunner.run(command, workingDirectory != null ? Path.of(workingDirectory) : null, env,
                cancellation);
    }

    List<String> buildCommand(EnrichedExecutionStep step) {
        List<String> argv = StepTemplates.optionalList(step, "argv");
        if (!argv.isEmpty()) {
            return argv.stream().map(arg -> StepTemplates.render(arg, step)).toList();
        }
        String commandLine = StepTemplates.optionalString(step, "command");
        if (commandLine == null || commandLine.isBlank()) {
            throw new StepExecutionException("protocolMetadata.argv or protocolMetadata.command is required");
        }
        String rendered = StepTemplates.render(commandLine, step, StepTemplates::shellQuote);
        if (System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win")) {
            return List.of("cmd.exe", "/c", StepTemplates.render(commandLine, step));
        }
        return List.of("/bin/sh", "-c", rendered);
    }
}
