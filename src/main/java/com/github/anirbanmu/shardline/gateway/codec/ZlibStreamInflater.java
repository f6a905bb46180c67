package com.github.anirbanmu.shardline.gateway.codec;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

// zlib-stream transport compression: the whole connection is one deflate stream.
// a message is complete when the bytes received so far end with the sync flush marker.
public final class ZlibStreamInflater {
    private static final byte[] FLUSH_SUFFIX = {0x00, 0x00, (byte) 0xFF, (byte) 0xFF};
    private static final int CHUNK = 8192;

    private final Inflater inflater = new Inflater();
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private final byte[] chunk = new byte[CHUNK];

    // returns the inflated message, or null while waiting for the rest of it
    public byte[] feed(byte[] frame) throws ProtocolException {
        pending.write(frame, 0, frame.length);
        if (!endsWithFlush(frame)) {
            return null;
        }

        byte[] input = pending.toByteArray();
        pending.reset();
        inflater.setInput(input);

        ByteArrayOutputStream out = new ByteArrayOutputStream(input.length * 4);
        try {
            // zero output means the inflater has consumed everything it was given
            int n;
            while ((n = inflater.inflate(chunk)) > 0) {
                out.write(chunk, 0, n);
            }
        } catch (DataFormatException ex) {
            throw new ProtocolException("corrupt zlib stream", ex);
        }
        if (inflater.needsDictionary()) {
            throw new ProtocolException("zlib stream requires a preset dictionary");
        }
        return out.toByteArray();
    }

    public void close() {
        inflater.end();
    }

    private static boolean endsWithFlush(byte[] frame) {
        if (frame.length < FLUSH_SUFFIX.length) {
            return false;
        }
        int offset = frame.length - FLUSH_SUFFIX.length;
        for (int i = 0; i < FLUSH_SUFFIX.length; i++) {
            if (frame[offset + i] != FLUSH_SUFFIX[i]) {
                return false;
            }
        }
        return true;
    }
}
