package org.harmar.kv.protocol;

import java.io.IOException;

/**
 * A line that is not a valid request or response.
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
