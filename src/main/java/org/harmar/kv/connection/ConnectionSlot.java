package org.harmar.kv.connection;

import java.net.InetAddress;
import java.util.concurrent.atomic.AtomicReference;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import org.harmar.kv.security.ConnectionAdmission;

/**
 * The admission slot held by one accepted connection.
 * {@link #close()} gives the slot back to the {@link ConnectionAdmission} exactly once.
 */
public final class ConnectionSlot implements AutoCloseable {
    public static final AttributeKey<ConnectionSlot> KEY = AttributeKey.valueOf("harmar.kv.slot");

    private final ConnectionAdmission admission;
    private final InetAddress address;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.ACCEPTED);

    public ConnectionSlot(ConnectionAdmission admission, InetAddress address) {
        this.admission = admission;
        this.address = address;
    }

    /**
     * Attach the slot to the channel and release it when the channel closes, whatever
     * the reason for closing.
     */
    public static ConnectionSlot bind(Channel channel, ConnectionSlot slot) {
        channel.attr(KEY).set(slot);
        channel.closeFuture().addListener(future -> slot.close());
        return slot;
    }

    public static ConnectionSlot of(Channel channel) {
        return channel.attr(KEY).get();
    }

    /**
     * ACCEPTED -> SERVING, ignored once closed
     */
    public boolean markServing() {
        return state.compareAndSet(ConnectionState.ACCEPTED, ConnectionState.SERVING);
    }

    @Override
    public void close() {
        if (state.getAndSet(ConnectionState.CLOSED) != ConnectionState.CLOSED) {
            admission.release(address);
        }
    }

    public ConnectionState getState() {
        return state.get();
    }

    public InetAddress getAddress() {
        return address;
    }
}
