package org.janelia.mediacomp.sound.io;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;

import org.janelia.mediacomp.sound.Sound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes sounds as mono 16 bit little-endian PCM WAV files.
 */
public class SoundWriter {

    private static final Logger LOG = LoggerFactory.getLogger(SoundWriter.class);

    public static void writeSound(Sound sound, Path path) throws IOException {
        long startTime = System.currentTimeMillis();
        short[] samples = sound.getSamples();
        byte[] pcm = new byte[2 * samples.length];
        for (int i = 0; i < samples.length; i++) {
            pcm[2 * i] = (byte) (samples[i] & 0xFF);
            pcm[2 * i + 1] = (byte) ((samples[i] >>> 8) & 0xFF);
        }
        float rate = (float) sound.getSamplingRate();
        AudioFormat format = new AudioFormat(AudioFormat.Encoding.PCM_SIGNED, rate, 16, 1, 2, rate, false);
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (AudioInputStream audioStream = new AudioInputStream(new ByteArrayInputStream(pcm), format, samples.length)) {
            AudioSystem.write(audioStream, AudioFileFormat.Type.WAVE, path.toFile());
        } finally {
            LOG.debug("Wrote {} to {} in {}ms", sound, path, System.currentTimeMillis() - startTime);
        }
    }
}
