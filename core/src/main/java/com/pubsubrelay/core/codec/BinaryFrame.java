package com.pubsubrelay.core.codec;

import lombok.Value;

/**
 * Decoded binary frame: UTF-8 JSON header bytes plus the raw attachment.
 */
@Value
public class BinaryFrame {
    byte[] header;
    byte[] attachment;
}
