package org.harmar.kv.security;

import java.net.InetAddress;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Point-in-time copy of the admission counters, taken under the admission lock.
 */
public final class AdmissionSnapshot {
    private final int activeConnections;
    private final Map<InetAddress, Integer> connectionsPerAddress;

    AdmissionSnapshot(int activeConnections, Map<InetAddress, Integer> connectionsPerAddress) {
        this.activeConnections = activeConnections;
        this.connectionsPerAddress = Collections.unmodifiableMap(new HashMap<>(connectionsPerAddress));
    }

    public int getActiveConnections() {
        return activeConnections;
    }

    public Map<InetAddress, Integer> getConnectionsPerAddress() {
        return connectionsPerAddress;
    }

    public int sumPerAddress() {
        int sum = 0;
        for (int count : connectionsPerAddress.values()) {
            sum += count;
        }
        return sum;
    }

    @Override
    public String toString() {
        return "AdmissionSnapshot{active=" + activeConnections + ", perAddress=" + connectionsPerAddress + "}";
    }
}
