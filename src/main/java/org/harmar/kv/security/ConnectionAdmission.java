package org.harmar.kv.security;

import java.net.InetAddress;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks open connections per client address and in total, and decides whether a new
 * connection may be accepted.
 *
 * <p>Both counters are guarded by one lock. {@link #admit(InetAddress)} checks both limits
 * and increments both counters inside the same critical section, so two concurrent attempts
 * can never both pass a check that only one of them may pass.
 *
 * <p>Every accepted connection must be paired with exactly one {@link #release(InetAddress)};
 * callers enforce the pairing (see {@code ConnectionSlot}).
 */
public class ConnectionAdmission {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionAdmission.class);

    // address -> open connections, addresses at zero are removed
    private final Map<InetAddress, Integer> connectionsPerAddress = new HashMap<>();

    private int activeConnections;

    private final int maxPerAddress;

    private final int maxTotal;

    private final ReentrantLock lock = new ReentrantLock();

    public ConnectionAdmission(int maxPerAddress, int maxTotal) {
        if (maxPerAddress <= 0) {
            throw new IllegalArgumentException("maxPerAddress: " + maxPerAddress + " (expected: > 0)");
        }
        if (maxTotal <= 0) {
            throw new IllegalArgumentException("maxTotal: " + maxTotal + " (expected: > 0)");
        }
        this.maxPerAddress = maxPerAddress;
        this.maxTotal = maxTotal;
    }

    /**
     * check whether a connection from the address may be accepted
     * @param address client ip
     * @return true if accepted and counted, false if a limit was reached
     */
    public boolean tryAccept(InetAddress address) {
        return admit(address).isAccepted();
    }

    /**
     * Same as {@link #tryAccept(InetAddress)} but reports which limit rejected the attempt.
     * The total limit is checked first.
     */
    public AdmissionDecision admit(InetAddress address) {
        Objects.requireNonNull(address, "address");

        AdmissionDecision decision;
        int fromAddress;
        int total;

        lock.lock();
        try {
            fromAddress = connectionsPerAddress.getOrDefault(address, 0);
            if (activeConnections >= maxTotal) {
                decision = AdmissionDecision.REJECTED_TOTAL_LIMIT;
            } else if (fromAddress >= maxPerAddress) {
                decision = AdmissionDecision.REJECTED_ADDRESS_LIMIT;
            } else {
                fromAddress++;
                connectionsPerAddress.put(address, fromAddress);
                activeConnections++;
                decision = AdmissionDecision.ACCEPTED;
            }
            total = activeConnections;
        } finally {
            lock.unlock();
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Connection from {} {} (address: {}/{}, total: {}/{})",
                    address.getHostAddress(), decision.getDescription(), fromAddress, maxPerAddress, total, maxTotal);
        }
        return decision;
    }

    /**
     * Give back the slot of one accepted connection. Releasing an address with no open
     * connections changes nothing.
     */
    public void release(InetAddress address) {
        Objects.requireNonNull(address, "address");

        int fromAddress;
        int total;

        lock.lock();
        try {
            Integer current = connectionsPerAddress.get(address);
            if (current == null || current <= 0) {
                total = activeConnections;
                fromAddress = -1;
            } else {
                fromAddress = current - 1;
                if (fromAddress == 0) {
                    connectionsPerAddress.remove(address);
                } else {
                    connectionsPerAddress.put(address, fromAddress);
                }
                activeConnections--;
                total = activeConnections;
            }
        } finally {
            lock.unlock();
        }

        if (fromAddress < 0) {
            logger.warn("Release for {} without an open connection ignored", address.getHostAddress());
        } else if (logger.isDebugEnabled()) {
            logger.debug("Connection from {} released (address: {}/{}, total: {}/{})",
                    address.getHostAddress(), fromAddress, maxPerAddress, total, maxTotal);
        }
    }

    public int activeConnections() {
        lock.lock();
        try {
            return activeConnections;
        } finally {
            lock.unlock();
        }
    }

    public int connectionsFrom(InetAddress address) {
        lock.lock();
        try {
            return connectionsPerAddress.getOrDefault(address, 0);
        } finally {
            lock.unlock();
        }
    }

    public AdmissionSnapshot snapshot() {
        lock.lock();
        try {
            return new AdmissionSnapshot(activeConnections, connectionsPerAddress);
        } finally {
            lock.unlock();
        }
    }

    public int maxPerAddress() {
        return maxPerAddress;
    }

    public int maxTotal() {
        return maxTotal;
    }
}
