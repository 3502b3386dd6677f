package me.golemcore.toolrouter.domain.model;

/**
 * Secret material for one host, produced by the credential resolver and only
 * ever handled inside backend adapters. {@link #toString()} masks the password.
 */
public record HostCredentials(String host, String username, String password, String identityFile, String domain) {

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }

    public boolean hasIdentityFile() {
        return identityFile != null && !identityFile.isBlank();
    }

    @Override
    public String toString() {
        return "HostCredentials[host=" + host + ", username=" + username + ", password="
                + (hasPassword() ? "****" : "none") + ", identityFile=" + identityFile + ", domain=" + domain + "]";
    }
}
