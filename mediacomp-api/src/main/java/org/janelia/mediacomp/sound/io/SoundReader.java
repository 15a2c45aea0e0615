package org.janelia.mediacomp.sound.io;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;

import org.janelia.mediacomp.sound.Sound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes WAV files. Any PCM input is converted to signed 16 bit samples and
 * multi-channel input is mixed down to mono by averaging the channels of each frame.
 */
public class SoundReader {

    private static final Logger LOG = LoggerFactory.getLogger(SoundReader.class);

    public static Sound readSound(Path path) throws IOException {
        long startTime = System.currentTimeMillis();
        try (InputStream inputStream = new BufferedInputStream(Files.newInputStream(path))) {
            return readSoundFromStream(inputStream);
        } catch (IOException e) {
            throw new IOException("Error reading sound from " + path, e);
        } finally {
            LOG.trace("Loaded sound from {} in {}ms", path, System.currentTimeMillis() - startTime);
        }
    }

    /**
     * @param inputStream must support mark/reset
     */
    public static Sound readSoundFromStream(InputStream inputStream) throws IOException {
        try (AudioInputStream sourceStream = AudioSystem.getAudioInputStream(inputStream)) {
            AudioFormat sourceFormat = sourceStream.getFormat();
            int channels = sourceFormat.getChannels();
            AudioFormat pcm16Format = new AudioFormat(
                    AudioFormat.Encoding.PCM_SIGNED,
                    sourceFormat.getSampleRate(),
                    16,
                    channels,
                    2 * channels,
                    sourceFormat.getSampleRate(),
                    false);
            try (AudioInputStream pcm16Stream = AudioSystem.getAudioInputStream(pcm16Format, sourceStream)) {
                byte[] data = pcm16Stream.readAllBytes();
                int frameSize = 2 * channels;
                short[] samples = new short[data.length / frameSize];
                for (int frame = 0; frame < samples.length; frame++) {
                    int sum = 0;
                    for (int c = 0; c < channels; c++) {
                        int offset = frame * frameSize + 2 * c;
                        sum += (short) ((data[offset] & 0xFF) | (data[offset + 1] << 8));
                    }
                    samples[frame] = (short) (sum / channels);
                }
                LOG.debug("Decoded {} frames with {} channels at {}Hz", samples.length, channels, sourceFormat.getSampleRate());
                return Sound.fromSamples(samples, sourceFormat.getSampleRate());
            }
        } catch (UnsupportedAudioFileException | IllegalArgumentException e) {
            throw new IOException("Unsupported audio data", e);
        }
    }
}
