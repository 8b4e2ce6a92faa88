package org.harmar.kv.connection;

public enum ConnectionState {
    ACCEPTED,
    SERVING,
    CLOSED
}
