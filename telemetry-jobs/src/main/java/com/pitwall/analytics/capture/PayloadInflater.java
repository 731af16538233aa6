package com.pitwall.analytics.capture;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Decodes compressed feed payloads: base64 text wrapping a raw (headerless) deflate stream.
 */
public final class PayloadInflater {
    public static final int DEFAULT_MAX_OUTPUT_BYTES = 50 * 1024 * 1024;
    private static final int CHUNK_BYTES = 8 * 1024;

    private PayloadInflater() {}

    public static String inflateBase64(String payload) throws IOException {
        return inflateBase64(payload, DEFAULT_MAX_OUTPUT_BYTES);
    }

    /**
     * @throws IOException when the payload is not base64, not a complete deflate stream, or inflates
     *     past {@code maxOutputBytes}
     */
    public static String inflateBase64(String payload, int maxOutputBytes) throws IOException {
        if (payload == null) {
            throw new IOException("Compressed payload is null");
        }
        byte[] compressed;
        try {
            compressed = Base64.getMimeDecoder().decode(payload.trim());
        } catch (IllegalArgumentException ex) {
            throw new IOException("Compressed payload is not valid base64", ex);
        }

        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.min(maxOutputBytes, compressed.length * 4 + 64));
            byte[] chunk = new byte[CHUNK_BYTES];
            while (!inflater.finished()) {
                int read = inflater.inflate(chunk);
                if (read == 0) {
                    if (inflater.needsInput() || inflater.needsDictionary()) {
                        throw new IOException("Compressed payload is truncated");
                    }
                    continue;
                }
                if (out.size() + read > maxOutputBytes) {
                    throw new IOException("Inflated payload exceeds " + maxOutputBytes + " bytes");
                }
                out.write(chunk, 0, read);
            }
            return out.toString(StandardCharsets.UTF_8);
        } catch (DataFormatException ex) {
            throw new IOException("Compressed payload is not a raw deflate stream", ex);
        } finally {
            inflater.end();
        }
    }
}
