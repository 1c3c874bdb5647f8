package com.phillippitts.voiceorders.service.audio;

/**
 * RMS amplitude of PCM16LE audio.
 *
 * <p>RMS is a measure of signal energy: speech sits well above the background level of
 * 16-bit PCM, which typically stays below 500-1000.
 */
public final class AudioEnergy {

    private AudioEnergy() {}

    /**
     * @return RMS amplitude (0-32767) over the whole buffer, 0 for an empty buffer
     */
    public static double rms(byte[] pcm) {
        if (pcm == null) {
            return 0;
        }
        return rms(pcm, 0, pcm.length);
    }

    /**
     * @param offset starting byte position
     * @param length number of bytes to analyze
     * @return RMS amplitude (0-32767) of the window
     */
    public static double rms(byte[] pcm, int offset, int length) {
        long sumSquares = 0;
        int sampleCount = 0;
        int end = Math.min(pcm.length, offset + length);
        for (int i = offset; i + 1 < end; i += 2) {
            int sample = (pcm[i] & 0xFF) | (pcm[i + 1] << 8);
            sumSquares += (long) sample * sample;
            sampleCount++;
        }
        if (sampleCount == 0) {
            return 0;
        }
        return Math.sqrt((double) sumSquares / sampleCount);
    }
}
