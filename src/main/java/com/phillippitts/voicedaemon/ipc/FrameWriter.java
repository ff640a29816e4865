package com.phillippitts.voicedaemon.ipc;

import com.phillippitts.voicedaemon.exception.FramingException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;

/**
 * Writes length-prefixed frames to a byte channel. Thread-safe: concurrent callers never
 * interleave partial frames.
 */
public final class FrameWriter {

    private final WritableByteChannel channel;
    private final int maxFrameBytes;

    public FrameWriter(WritableByteChannel channel, int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
        this.channel = channel;
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Encodes and writes one frame.
     *
     * @throws FramingException if the encoded payload exceeds the frame limit
     * @throws IOException on channel failure
     */
    public synchronized void writeFrame(String payload) throws IOException {
        ByteBuffer frame = ByteBuffer.wrap(encode(payload, maxFrameBytes));
        while (frame.hasRemaining()) {
            channel.write(frame);
        }
    }

    /**
     * Returns the wire encoding of one frame.
     */
    public static byte[] encode(String payload, int maxFrameBytes) {
        byte[] body = payload.getBytes(StandardCharsets.UTF_8);
        if (body.length > maxFrameBytes) {
            throw new FramingException("Outbound frame of " + body.length + " bytes exceeds limit of "
                    + maxFrameBytes + " bytes");
        }
        return ByteBuffer.allocate(FrameReader.HEADER_BYTES + body.length)
                .putInt(body.length)
                .put(body)
                .array();
    }
}
