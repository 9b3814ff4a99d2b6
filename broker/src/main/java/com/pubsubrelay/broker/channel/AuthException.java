package com.pubsubrelay.broker.channel;

import com.pubsubrelay.core.msg.CloseCode;

public class AuthException extends JoinRejectedException {
    public AuthException() {
        super(CloseCode.UNAUTHORIZED);
    }
}
