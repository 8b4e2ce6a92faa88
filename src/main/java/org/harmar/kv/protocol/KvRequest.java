package org.harmar.kv.protocol;

import java.util.Objects;

public final class KvRequest {
    private final Operation operation;
    private final String key;
    // only for SET
    private final String value;

    private KvRequest(Operation operation, String key, String value) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.key = Objects.requireNonNull(key, "key");
        this.value = value;
    }

    public static KvRequest set(String key, String value) {
        return new KvRequest(Operation.SET, key, Objects.requireNonNull(value, "value"));
    }

    public static KvRequest get(String key) {
        return new KvRequest(Operation.GET, key, null);
    }

    public static KvRequest delete(String key) {
        return new KvRequest(Operation.DELETE, key, null);
    }

    public Operation getOperation() {
        return operation;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KvRequest)) return false;
        KvRequest that = (KvRequest) o;
        return operation == that.operation && key.equals(that.key) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, key, value);
    }

    @Override
    public String toString() {
        return operation.getWireName() + " " + key;
    }
}
