package org.harmar.kv.protocol;

import java.util.Objects;
import java.util.Optional;

public final class KvResponse {
    private final Operation operation;
    // GET only, null when the key is absent
    private final String value;

    private KvResponse(Operation operation, String value) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.value = value;
    }

    public static KvResponse set() {
        return new KvResponse(Operation.SET, null);
    }

    public static KvResponse delete() {
        return new KvResponse(Operation.DELETE, null);
    }

    public static KvResponse get(Optional<String> value) {
        return new KvResponse(Operation.GET, value.orElse(null));
    }

    public Operation getOperation() {
        return operation;
    }

    public Optional<String> getValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KvResponse)) return false;
        KvResponse that = (KvResponse) o;
        return operation == that.operation && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, value);
    }

    @Override
    public String toString() {
        return operation.getWireName() + (value == null ? "" : " -> " + value);
    }
}
