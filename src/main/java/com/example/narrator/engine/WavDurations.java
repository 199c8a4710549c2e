package com.example.narrator.engine;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads playback length from a WAV header. Streamed WAVs carry no frame count, so the data size
 * is used instead.
 */
final class WavDurations {
    private static final int CANONICAL_HEADER_BYTES = 44;

    private WavDurations() {
    }

    static double durationSeconds(Path wav) throws IOException {
        try {
            AudioFileFormat fileFormat = AudioSystem.getAudioFileFormat(wav.toFile());
            AudioFormat format = fileFormat.getFormat();
            float frameRate = format.getFrameRate();
            if (frameRate <= 0) {
                throw new IOException("WAV without frame rate: " + wav);
            }
            long frames = fileFormat.getFrameLength();
            if (frames != AudioSystem.NOT_SPECIFIED && frames > 0) {
                return frames / (double) frameRate;
            }
            int frameSize = format.getFrameSize();
            if (frameSize <= 0) {
                throw new IOException("WAV without frame size: " + wav);
            }
            long dataBytes = Math.max(0L, Files.size(wav) - CANONICAL_HEADER_BYTES);
            return dataBytes / (double) frameSize / frameRate;
        } catch (UnsupportedAudioFileException e) {
            throw new IOException("Not a WAV file: " + wav, e);
        }
    }
}
