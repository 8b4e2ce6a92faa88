package org.harmar.kv.protocol;

import java.util.Locale;

public enum Operation {

    SET("set"),
    GET("get"),
    DELETE("delete");

    private final String wireName;

    Operation(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * look up by wire name, case-insensitive
     * @return the operation or null if unknown
     */
    public static Operation fromWireName(String name) {
        if (name == null) return null;
        String lower = name.toLowerCase(Locale.ROOT);
        for (Operation op : values()) {
            if (op.wireName.equals(lower)) return op;
        }
        return null;
    }
}
