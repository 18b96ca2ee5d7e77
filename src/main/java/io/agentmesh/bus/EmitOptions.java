package io.agentmesh.bus;

public record EmitOptions(
        String source,
        String correlationId,
        long delayMs,
        RetryPolicy retry
) {
    public static EmitOptions defaults() {
        return new EmitOptions(null, null, 0L, null);
    }

    public static EmitOptions fromSource(String source) {
        return new EmitOptions(source, null, 0L, null);
    }

    public EmitOptions source(String value) {
        return new EmitOptions(value, correlationId, delayMs, retry);
    }

    public EmitOptions correlationId(String value) {
        return new EmitOptions(source, value, delayMs, retry);
    }

    public EmitOptions delayMs(long value) {
        return new EmitOptions(source, correlationId, value, retry);
    }

    public EmitOptions retry(int attempts, long backoffMs) {
        return new EmitOptions(source, correlationId, delayMs, new RetryPolicy(attempts, backoffMs));
    }

    /**
     * Re-emission after {@code backoffMs * 2^(n-1)} for the n-th retry, while any listener failed.
     */
    public record RetryPolicy(int attempts, long backoffMs) {
        public RetryPolicy {
            if (attempts < 0) {
                throw new IllegalArgumentException("attempts must be >= 0");
            }
            if (backoffMs < 0L) {
                throw new IllegalArgumentException("backoffMs must be >= 0");
            }
        }

        public long delayForRetry(int retryCount) {
            int exponent = Math.max(0, Math.min(retryCount - 1, 30));
            return backoffMs * (1L << exponent);
        }
    }
}
