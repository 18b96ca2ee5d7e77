package io.agentmesh.model;

public enum Priority {
    URGENT("urgent", 3),
    HIGH("high", 2),
    NORMAL("normal", 1),
    LOW("low", 0);

    private final String label;
    private final int rank;

    Priority(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String label() {
        return label;
    }

    /**
     * Higher rank drains first.
     */
    public int rank() {
        return rank;
    }

    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        for (Priority value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.label.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        if ("critical".equalsIgnoreCase(raw)) {
            return URGENT;
        }
        if ("medium".equalsIgnoreCase(raw)) {
            return NORMAL;
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
