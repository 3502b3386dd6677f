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
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.BackendAdapterPort;
import me.golemcore.toolrouter.port.outbound.CredentialResolverPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a shell command on the step's target host through the system OpenSSH
 * client in batch mode. Location key {@code ssh}.
 *
 * <p>
 * Authentication is key-based: the host's {@code identity-file} is passed with
 * {@code -i}. Password-only credentials are rejected because batch mode cannot
 * prompt. Understood {@code protocolMetadata} keys: {@code command} (required,
 * input values are shell-quoted) and {@code port} (overrides
 * {@code toolrouter.backends.ssh.port}).
 */
@Component
@Slf4j
public class SshBackendAdapter implements BackendAdapterPort {

    private final ToolRouterProperties.SshProperties config;
    private final CredentialResolverPort credentialResolver;

    public SshBackendAdapter(ToolRouterProperties properties, CredentialResolverPort credentialResolver) {
        this.config = properties.getBackends().getSsh();
        this.credentialResolver = credentialResolver;
    }

    @Override
    public String getLocation() {
        return "ssh";
    }

    @Override
    public StepResult execute(EnrichedExecutionStep step, CancellationToken cancellation) {
        List<String> command = buildCommand(step);
        log.debug("[SSH] Step {} on {}", step.getId(), step.getTargetHost());
        return ProcessRunner.run(command, null, Map.of(), cancellation);
    }

    List<String> buildCommand(EnrichedExecutionStep step) {
        if (step.getTargetHost() == null || step.getTargetHost().isBlank()) {
            throw new StepExecutionException("SSH step " + step.getId() + " has no targetHost");
        }
        if (step.getTargetHost().startsWith("-")) {
            throw new StepExecutionException("SSH step " + step.getId() + " has an invalid targetHost: "
                    + step.getTargetHost());
        }
        String remoteCommand = StepTemplates.render(StepTemplates.requiredString(step, "command"), step,
                StepTemplates::shellQuote);
        String port = StepTemplates.optionalString(step, "port");

        List<String> command = new ArrayList<>();
        command.add(config.getBinary());
        command.add("-o");
        command.add("BatchMode=yes");
        command.add("-o");
        command.add("ConnectTimeout=" + Math.max(1, config.getConnectTimeout().toSeconds()));
        command.add("-p");
        command.add(port != null ? port : String.valueOf(config.getPort()));

        String destination = step.getTargetHost();
        HostCredentials credentials = BackendCredentials.forStep(credentialResolver, step).orElse(null);
        if (credentials != null) {
            if (!credentials.hasIdentityFile()) {
                throw new StepExecutionException("SSH to " + step.getTargetHost()
                        + " needs an identity file; password authentication is not supported in batch mode");
            }
            command.add("-i");
            command.add(credentials.identityFile());
            if (credentials.username() != null && !credentials.username().isBlank()) {
                destination = credentials.username() + "@" + destination;
            }
        }
        // Everything after "--" is the destination and remote command, never an option.
        command.add("--");
        command.add(destination);
        command.add(remoteCommand);
        return command;
    }
}
