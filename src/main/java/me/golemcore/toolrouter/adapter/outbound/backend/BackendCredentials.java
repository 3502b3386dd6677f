package me.golemcore.toolrouter.adapter.outbound.backend;

import me.golemcore.toolrouter.domain.exception.StepExecutionException;
import me.golemcore.toolrouter.domain.model.CredentialHandle;
import me.golemcore.toolrouter.domain.model.EnrichedExecutionStep;
import me.golemcore.toolrouter.domain.model.HostCredentials;
import me.golemcore.toolrouter.port.outbound.CredentialResolverPort;

import java.util.Optional;

/**
 * Credential lookup shared by the remote adapters.
 */
final class BackendCredentials {

    private BackendCredentials() {
    }

    /**
     * Resolves the step's credentials when it requires them; empty otherwise.
     *
     * @throws StepExecutionException
     *             if credentials are required but none are configured
     */
    static Optional<HostCredentials> forStep(CredentialResolverPort resolver, EnrichedExecutionStep step) {
        if (!step.isRequiresCredentials()) {
            return Optional.empty();
        }
        CredentialHandle handle = step.getCredentialHandle();
        if (handle == null) {
            if (step.getTargetHost() == null || step.getTargetHost().isBlank()) {
                throw new StepExecutionException("Step " + step.getId() + " requires credentials but has no target host");
            }
            handle = CredentialHandle.forHost(step.getTargetHost());
        }
        HostCredentials credentials = resolver.resolve(handle)
                .orElseThrow(() -> new StepExecutionException("No credentials configured for host "
                        + step.getTargetHost()));
        return Optional.of(credentials);
    }
}
