package com.phillippitts.voiceorders.service.audio;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Converts between raw PCM16LE and minimal RIFF/WAVE containers.
 *
 * <p>Layout:
 * <pre>
 * RIFF header (12 bytes) | "fmt " chunk (8 + 16 bytes) | "data" chunk (8 bytes + PCM)
 * </pre>
 */
public final class WavCodec {

    public static final int HEADER_SIZE = 44;
    private static final int RIFF_HEADER_SIZE = 12;
    private static final int CHUNK_HEADER_SIZE = 8;
    private static final int FMT_CHUNK_MIN_SIZE = 16;
    private static final int AUDIO_FORMAT_PCM = 1;

    private WavCodec() {}

    /**
     * Decoded WAV payload.
     *
     * @param pcm        raw PCM16LE bytes
     * @param sampleRate sample rate from the fmt chunk
     * @param channels   channel count from the fmt chunk
     */
    public record Decoded(byte[] pcm, int sampleRate, int channels) {}

    /**
     * Wraps PCM16LE audio in a WAV container.
     */
    public static byte[] wrap(byte[] pcm, int sampleRate, int channels) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        int blockAlign = AudioFormat.BYTES_PER_SAMPLE * channels;
        ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        header.put(ascii("RIFF"));
        header.putInt(36 + pcm.length);
        header.put(ascii("WAVE"));
        header.put(ascii("fmt "));
        header.putInt(FMT_CHUNK_MIN_SIZE);
        header.putShort((short) AUDIO_FORMAT_PCM);
        header.putShort((short) channels);
        header.putInt(sampleRate);
        header.putInt(sampleRate * blockAlign);
        header.putShort((short) blockAlign);
        header.putShort((short) AudioFormat.BITS_PER_SAMPLE);
        header.put(ascii("data"));
        header.putInt(pcm.length);

        ByteArrayOutputStream out = new ByteArrayOutputStream(HEADER_SIZE + pcm.length);
        out.writeBytes(header.array());
        out.writeBytes(pcm);
        return out.toByteArray();
    }

    /**
     * Extracts PCM16LE audio from a WAV container, skipping chunks other than {@code fmt } and {@code data}.
     *
     * @throws IllegalArgumentException if the bytes are not a 16-bit PCM WAV file
     */
    public static Decoded unwrap(byte[] wav) {
        Objects.requireNonNull(wav, "wav must not be null");
        if (wav.length < RIFF_HEADER_SIZE || !tag(wav, 0).equals("RIFF") || !tag(wav, 8).equals("WAVE")) {
            throw new IllegalArgumentException("Not a RIFF/WAVE stream");
        }
        ByteBuffer buf = ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN);
        int sampleRate = -1;
        int channels = -1;
        int pos = RIFF_HEADER_SIZE;
        while (pos + CHUNK_HEADER_SIZE <= wav.length) {
            String id = tag(wav, pos);
            long size = Integer.toUnsignedLong(buf.getInt(pos + 4));
            int body = pos + CHUNK_HEADER_SIZE;
            if (id.equals("fmt ")) {
                if (size < FMT_CHUNK_MIN_SIZE || body + FMT_CHUNK_MIN_SIZE > wav.length) {
                    throw new IllegalArgumentException("Truncated fmt chunk");
                }
                int format = buf.getShort(body) & 0xFFFF;
                channels = buf.getShort(body + 2) & 0xFFFF;
                sampleRate = buf.getInt(body + 4);
                int bits = buf.getShort(body + 14) & 0xFFFF;
                if (format != AUDIO_FORMAT_PCM || bits != AudioFormat.BITS_PER_SAMPLE) {
                    throw new IllegalArgumentException(
                            "Unsupported WAV encoding: format=" + format + ", bits=" + bits);
                }
            } else if (id.equals("data")) {
                if (sampleRate <= 0 || channels <= 0) {
                    throw new IllegalArgumentException("data chunk before fmt chunk");
                }
                // Streaming encoders write 0 or 0xFFFFFFFF when the length is unknown
                int end = (size == 0 || body + size > wav.length) ? wav.length : (int) (body + size);
                byte[] pcm = new byte[end - body];
                System.arraycopy(wav, body, pcm, 0, pcm.length);
                return new Decoded(pcm, sampleRate, channels);
            }
            pos = (int) Math.min(Integer.MAX_VALUE, body + size + (size & 1));
        }
        throw new IllegalArgumentException("WAV stream has no data chunk");
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    private static String tag(byte[] data, int offset) {
        return new String(data, offset, 4, StandardCharsets.US_ASCII);
    }
}
