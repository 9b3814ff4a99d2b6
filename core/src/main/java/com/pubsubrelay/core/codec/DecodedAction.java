package com.pubsubrelay.core.codec;

import com.pubsubrelay.core.msg.ClientAction;
import lombok.Value;

/**
 * A client action together with the attachment that arrived with it ({@code null} for text frames).
 */
@Value
public class DecodedAction {
    ClientAction action;
    byte[] attachment;

    public boolean hasAttachment() {
        return attachment != null;
    }
}
