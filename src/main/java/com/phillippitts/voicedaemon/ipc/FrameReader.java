package com.phillippitts.voicedaemon.ipc;

import com.phillippitts.voicedaemon.exception.FramingException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Reads length-prefixed frames from a byte channel.
 *
 * <p>Wire format: {@code [4 bytes unsigned length N, big-endian][N bytes UTF-8 payload]}.
 * Frames are read lazily, one per call; the reader holds no state between frames beyond the
 * channel position, so reading can resume after any complete frame.
 *
 * <p>Not thread-safe; each connection owns one reader on its reader thread.
 */
public final class FrameReader {

    static final int HEADER_BYTES = 4;

    private final ReadableByteChannel channel;
    private final int maxFrameBytes;
    private final ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES);

    public FrameReader(ReadableByteChannel channel, int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
        this.channel = channel;
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Reads the next complete frame.
     *
     * @return decoded payload, or {@code null} when the peer closed the stream cleanly between frames
     * @throws FramingException if the declared length exceeds the limit, the stream ends
     *         mid-frame, or the payload is not valid UTF-8
     * @throws IOException on channel failure
     */
    public String readFrame() throws IOException {
        header.clear();
        int headerRead = fill(header);
        if (headerRead == 0) {
            return null;
        }
        if (header.hasRemaining()) {
            throw new FramingException("Stream closed mid-header after " + headerRead + " of "
                    + HEADER_BYTES + " bytes");
        }
        header.flip();
        long length = Integer.toUnsignedLong(header.getInt(0));
        if (length > maxFrameBytes) {
            if (header.get(0) == '{') {
                throw new FramingException("Frame header looks like raw JSON; "
                        + "messages must be prefixed with a 4-byte big-endian length");
            }
            throw new FramingException("Frame of " + length + " bytes exceeds limit of "
                    + maxFrameBytes + " bytes");
        }

        ByteBuffer body = ByteBuffer.allocate((int) length);
        int bodyRead = fill(body);
        if (body.hasRemaining()) {
            throw new FramingException("Stream closed mid-frame after " + bodyRead + " of "
                    + length + " payload bytes");
        }
        body.flip();
        return decodeUtf8(body);
    }

    /**
     * Reads until the buffer is full or the channel reports end of stream.
     *
     * @return number of bytes read
     */
    private int fill(ByteBuffer buffer) throws IOException {
        int total = 0;
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }

    private static String decodeUtf8(ByteBuffer body) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer chars = decoder.decode(body);
            return chars.toString();
        } catch (CharacterCodingException e) {
            throw new FramingException("Frame payload is not valid UTF-8", e);
        }
    }
}
