package com.pubsubrelay.broker.channel;

import com.pubsubrelay.core.msg.CloseCode;
import lombok.Getter;

/**
 * A join refused before {@code ready}; the transport closes the socket with {@link #getCloseCode()}.
 */
@Getter
public class JoinRejectedException extends RuntimeException {
    private final CloseCode closeCode;

    public JoinRejectedException(CloseCode closeCode) {
        super(closeCode.reason());
        this.closeCode = closeCode;
    }
}
