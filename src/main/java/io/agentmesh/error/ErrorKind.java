package io.agentmesh.error;

public enum ErrorKind {
    VALIDATION(false),
    AGENT_NOT_FOUND(false),
    AGENT_UNAVAILABLE(false),
    UNSUPPORTED_METHOD(false),
    TIMEOUT(true),
    EXECUTION(false),
    CIRCUIT_OPEN(true),
    RATE_LIMITED(true),
    BLOCKED(false),
    CONFIGURATION(false);

    private final boolean retryableByDefault;

    ErrorKind(boolean retryableByDefault) {
        this.retryableByDefault = retryableByDefault;
    }

    public boolean retryableByDefault() {
        return retryableByDefault;
    }
}
