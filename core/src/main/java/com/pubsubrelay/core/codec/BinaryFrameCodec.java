package com.pubsubrelay.core.codec;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Optional;

/**
 * Length-prefixed binary frame layout.
 * <pre>
 * +--------+----------------------+-------------------+---------------------+
 * | 0x00   | header length (u32LE)| header (UTF-8 JSON)| attachment (raw)   |
 * +--------+----------------------+-------------------+---------------------+
 *   1 byte        4 bytes              N bytes           to end of frame
 * </pre>
 */
public final class BinaryFrameCodec {
    private BinaryFrameCodec() {
    }

    public static final byte MARKER = 0;
    public static final int HEADER_OFFSET = 5;

    /**
     * Builds a binary frame.
     *
     * @param header     serialized JSON header
     * @param attachment raw attachment bytes (may be empty)
     * @return frame bytes
     */
    public static byte[] encode(byte[] header, byte[] attachment) {
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_OFFSET + header.length + attachment.length)
                .order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(MARKER);
        buffer.putInt(header.length);
        buffer.put(header);
        buffer.put(attachment);
        return buffer.array();
    }

    /**
     * Splits a binary frame into header and attachment.
     *
     * @param frame frame bytes
     * @return the decoded parts, or empty if the bytes do not follow the layout
     */
    public static Optional<BinaryFrame> decode(byte[] frame) {
        if (frame.length < HEADER_OFFSET || frame[0] != MARKER) {
            return Optional.empty();
        }

        ByteBuffer buffer = ByteBuffer.wrap(frame).order(ByteOrder.LITTLE_ENDIAN);
        long headerLength = Integer.toUnsignedLong(buffer.getInt(1));
        if (headerLength == 0 || HEADER_OFFSET + headerLength > frame.length) {
            return Optional.empty();
        }

        int headerEnd = HEADER_OFFSET + (int) headerLength;
        byte[] header = new byte[(int) headerLength];
        System.arraycopy(frame, HEADER_OFFSET, header, 0, header.length);
        byte[] attachment = new byte[frame.length - headerEnd];
        System.arraycopy(frame, headerEnd, attachment, 0, attachment.length);
        return Optional.of(new BinaryFrame(header, attachment));
    }
}
