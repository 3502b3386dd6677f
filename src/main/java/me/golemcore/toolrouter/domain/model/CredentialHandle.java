package me.golemcore.toolrouter.domain.model;

/**
 * Opaque reference to credentials for one target host. Only backend adapters
 * exchange it for secret material, through the credential resolver.
 */
public record CredentialHandle(String host, String reference) {

    public static CredentialHandle forHost(String host) {
        return new CredentialHandle(host, "host:" + host);
    }
}
