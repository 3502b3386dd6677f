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
import me.golemcore.toolrouter.domain.model.StepResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs an OS process to completion with merged stdout/stderr. Cancellation
 * destroys the process, which also ends the output read.
 */
@Slf4j
final class ProcessRunner {

    static final int MAX_OUTPUT_CHARS = 100_000;

    private ProcessRunner() {
    }

    static StepResult run(List<String> command, Path workingDirectory, Map<String, String> environment,
            CancellationToken cancellation) {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        if (workingDirectory != null) {
            pb.directory(workingDirectory.toFile());
        }
        pb.environment().putAll(environment);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new StepExecutionException("Failed to start " + command.get(0) + ": " + e.getMessage(), e);
        }
        cancellation.onCancel(() -> {
            log.debug("[Process] Destroying {} (pid {})", command.get(0), process.pid());
            process.destroyForcibly();
        });

        String output;
        try {
            output = readOutput(process);
            int exitCode = process.waitFor();
            if (cancellation.isCancelled()) {
                throw new StepExecutionException("Process cancelled", exitCode, output, null);
            }
            if (exitCode != 0) {
                throw new StepExecutionException("Process exited with code " + exitCode, exitCode, output, null);
            }
            return StepResult.success(output, exitCode);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new StepExecutionException("Interrupted waiting for process", e);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new StepExecutionException("Failed to read process output: " + e.getMessage(), e);
        }
    }

    private static String readOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        boolean truncated = false;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() < MAX_OUTPUT_CHARS) {
                    output.append(line).append('\n');
                } else {
                    truncated = true;
                }
                line = reader.readLine();
            }
        }
        if (truncated) {
            output.append("[Output truncated...]\n");
        }
        return output.toString();
    }
}
