package com.phillippitts.voiceorders.service.audio;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WavCodecTest {

    @Test
    void writesCanonicalHeader() {
        byte[] pcm = new byte[3200];

        byte[] wav = WavCodec.wrap(pcm, 16000, 1);

        assertThat(wav).hasSize(WavCodec.HEADER_SIZE + pcm.length);
        ByteBuffer buf = ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(new String(wav, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("RIFF");
        assertThat(buf.getInt(4)).isEqualTo(36 + pcm.length);
        assertThat(new String(wav, 8, 4, StandardCharsets.US_ASCII)).isEqualTo("WAVE");
        assertThat(buf.getShort(20)).isEqualTo((short) 1);
        assertThat(buf.getShort(22)).isEqualTo((short) 1);
        assertThat(buf.getInt(24)).isEqualTo(16000);
        assertThat(buf.getInt(28)).isEqualTo(32000);
        assertThat(buf.getShort(34)).isEqualTo((short) 16);
        assertThat(new String(wav, 36, 4, StandardCharsets.US_ASCII)).isEqualTo("data");
        assertThat(buf.getInt(40)).isEqualTo(pcm.length);
    }

    @Test
    void unwrapsWhatItWraps() {
        byte[] pcm = {1, 2, 3, 4, 5, 6};

        WavCodec.Decoded decoded = WavCodec.unwrap(WavCodec.wrap(pcm, 24000, 2));

        assertThat(decoded.pcm()).containsExactly(pcm);
        assertThat(decoded.sampleRate()).isEqualTo(24000);
        assertThat(decoded.channels()).isEqualTo(2);
    }

    @Test
    void skipsUnknownChunks() {
        byte[] pcm = {9, 8, 7, 6};
        byte[] plain = WavCodec.wrap(pcm, 22050, 1);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(plain, 0, 36);
        out.writeBytes("LIST".getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(le(3));
        out.writeBytes(new byte[] {0, 0, 0, 0});
        out.write(plain, 36, plain.length - 36);

        WavCodec.Decoded decoded = WavCodec.unwrap(out.toByteArray());

        assertThat(decoded.pcm()).containsExactly(pcm);
        assertThat(decoded.sampleRate()).isEqualTo(22050);
    }

    @Test
    void readsToEndWhenDataSizeIsUnknown() {
        byte[] pcm = {1, 1, 2, 2, 3, 3};
        byte[] wav = WavCodec.wrap(pcm, 16000, 1);
        ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN).putInt(40, -1);

        assertThat(WavCodec.unwrap(wav).pcm()).containsExactly(pcm);

        ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN).putInt(40, 0);
        assertThat(WavCodec.unwrap(wav).pcm()).containsExactly(pcm);
    }

    @Test
    void rejectsNonWavInput() {
        assertThatThrownBy(() -> WavCodec.unwrap("not a wav file at all".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WavCodec.unwrap(new byte[4]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNon16BitAudio() {
        byte[] wav = WavCodec.wrap(new byte[4], 16000, 1);
        ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN).putShort(34, (short) 8);

        assertThatThrownBy(() -> WavCodec.unwrap(wav))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bits=8");
    }

    @Test
    void rejectsStreamWithoutDataChunk() {
        byte[] headerOnly = Arrays.copyOf(WavCodec.wrap(new byte[0], 16000, 1), 36);

        assertThatThrownBy(() -> WavCodec.unwrap(headerOnly))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no data chunk");
    }

    private static byte[] le(int value) {
        return ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(value).array();
    }
}
