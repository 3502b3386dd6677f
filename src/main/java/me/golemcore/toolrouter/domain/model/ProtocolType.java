package me.golemcore.toolrouter.domain.model;

/**
 * Protocol family a backend adapter speaks. Stamped on an execution step at
 * selection time together with the execution location.
 */
public enum ProtocolType {
    LOCAL_PROCESS, REMOTE_SHELL, REMOTE_MANAGEMENT, HTTP, DATABASE, CUSTOM
}
