package io.agentmesh.util;

import java.util.UUID;

public final class Ids {
    private Ids() {
    }

    public static String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID();
    }

    public static String shortId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
