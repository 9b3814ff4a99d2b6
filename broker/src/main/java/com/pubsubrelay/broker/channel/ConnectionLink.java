package com.pubsubrelay.broker.channel;

import com.pubsubrelay.core.msg.CloseCode;

/**
 * Transport-side handle of a connection, used by the broker to terminate it.
 */
public interface ConnectionLink {

    /**
     * Sends a close frame with the given code and closes the underlying socket. Must not block.
     */
    void close(CloseCode code);
}
