package org.harmar.kv.security;

public enum AdmissionDecision {

    ACCEPTED("accepted"),
    REJECTED_TOTAL_LIMIT("total connection limit reached"),
    REJECTED_ADDRESS_LIMIT("per-address connection limit reached");

    private final String description;

    AdmissionDecision(String description) {
        this.description = description;
    }

    public boolean isAccepted() {
        return this == ACCEPTED;
    }

    public String getDescription() {
        return description;
    }
}
