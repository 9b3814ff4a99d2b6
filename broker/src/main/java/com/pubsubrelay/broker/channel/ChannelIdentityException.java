package com.pubsubrelay.broker.channel;

import com.pubsubrelay.core.msg.CloseCode;

/**
 * The requested {@code contextId} conflicts with the identity the channel is bound to.
 */
public class ChannelIdentityException extends JoinRejectedException {
    public ChannelIdentityException(CloseCode closeCode) {
        super(closeCode);
    }
}
