package me.golemcore.toolrouter.port.outbound;

import me.golemcore.toolrouter.domain.model.CredentialHandle;
import me.golemcore.toolrouter.domain.model.HostCredentials;

import java.util.Optional;

/**
 * Exchanges a credential handle for the host's secret material. Called only
 * from backend adapters.
 */
public interface CredentialResolverPort {

    Optional<HostCredentials> resolve(CredentialHandle handle);
}
