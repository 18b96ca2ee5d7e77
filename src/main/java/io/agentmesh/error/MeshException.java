package io.agentmesh.error;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Structured failure raised by every orchestration component.
 *
 * <p>Callers branch on {@link #kind()} and {@link #retryable()} instead of parsing messages.
 * {@link #attempt()} is bumped by the retry primitive each time the failing operation is
 * tried again.
 */
public class MeshException extends RuntimeException {
    private final ErrorKind kind;
    private final Map<String, Object> details;
    private final boolean retryable;
    private final String source;
    private final AtomicInteger attempt;

    public MeshException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), kind.retryableByDefault(), null, null);
    }

    public MeshException(ErrorKind kind, String message, Map<String, Object> details) {
        this(kind, message, details, kind.retryableByDefault(), null, null);
    }

    public MeshException(
            ErrorKind kind,
            String message,
            Map<String, Object> details,
            boolean retryable,
            String source,
            Throwable cause
    ) {
        super(message, cause);
        this.kind = kind;
        this.details = details == null ? Map.of() : Map.copyOf(details);
        this.retryable = retryable;
        this.source = source;
        this.attempt = new AtomicInteger(0);
    }

    public static MeshException validation(String message) {
        return new MeshException(ErrorKind.VALIDATION, message);
    }

    public static MeshException validation(String message, Map<String, Object> details) {
        return new MeshException(ErrorKind.VALIDATION, message, details);
    }

    public static MeshException agentNotFound(String agentId) {
        return new MeshException(ErrorKind.AGENT_NOT_FOUND, "Agent not found: " + agentId, Map.of("agent", String.valueOf(agentId)));
    }

    public static MeshException timeout(String message, Map<String, Object> details) {
        return new MeshException(ErrorKind.TIMEOUT, message, details);
    }

    /**
     * Wraps a handler failure with the agent that raised it. An existing {@link MeshException}
     * keeps its kind and retryable flag; only the source is attached.
     */
    public static MeshException execution(String agentId, Throwable cause) {
        Throwable root = unwrap(cause);
        if (root instanceof MeshException mesh) {
            if (mesh.source() != null) {
                return mesh;
            }
            return new MeshException(
                    mesh.kind(),
                    mesh.getMessage(),
                    mesh.details(),
                    mesh.retryable(),
                    "agent:" + agentId,
                    mesh
            );
        }
        String message = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        return new MeshException(
                ErrorKind.EXECUTION,
                "Agent " + agentId + ": " + message,
                Map.of("agent", agentId, "cause", root.getClass().getName()),
                false,
                "agent:" + agentId,
                root
        );
    }

    /**
     * Converts anything thrown out of a future or a handler into a {@link MeshException}.
     */
    public static MeshException from(Throwable error) {
        Throwable root = unwrap(error);
        if (root instanceof MeshException mesh) {
            return mesh;
        }
        String message = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        return new MeshException(ErrorKind.EXECUTION, message, Map.of("cause", root.getClass().getName()), false, null, root);
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public ErrorKind kind() {
        return kind;
    }

    public Map<String, Object> details() {
        return details;
    }

    public boolean retryable() {
        return retryable;
    }

    public String source() {
        return source;
    }

    public int attempt() {
        return attempt.get();
    }

    public int incrementAttempt() {
        return attempt.incrementAndGet();
    }
}
