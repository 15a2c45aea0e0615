package org.janelia.mediacomp.sound;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

import com.google.common.base.Preconditions;
import org.janelia.mediacomp.MediaPreconditions;
import org.janelia.mediacomp.files.MediaPath;
import org.janelia.mediacomp.sound.io.SoundReader;
import org.janelia.mediacomp.sound.io.SoundWriter;

/**
 * A mono sound: a fixed number of signed 16 bit samples played at a given sampling rate.
 */
public class Sound implements Iterable<Sample> {

    public static final double DEFAULT_SAMPLING_RATE = 22050.0;
    public static final double MAX_DURATION_SECONDS = 600.0;
    public static final int MIN_SAMPLE_VALUE = Short.MIN_VALUE;
    public static final int MAX_SAMPLE_VALUE = Short.MAX_VALUE;

    public static Sound makeEmpty(int numSamples) {
        return makeEmpty(numSamples, DEFAULT_SAMPLING_RATE);
    }

    /**
     * Create a silent sound.
     *
     * @throws IllegalArgumentException if the rate is not positive, the number of samples is negative
     * or the sound would last longer than 600 seconds
     */
    public static Sound makeEmpty(int numSamples, double samplingRate) {
        Preconditions.checkArgument(samplingRate > 0, "In makeEmpty: sampling rate must be positive, actually %s", samplingRate);
        Preconditions.checkArgument(numSamples >= 0, "In makeEmpty: number of samples must not be negative, actually %s", numSamples);
        Preconditions.checkArgument(numSamples / samplingRate <= MAX_DURATION_SECONDS,
                "In makeEmpty: %s samples at %s samples per second last longer than %s seconds",
                numSamples, samplingRate, MAX_DURATION_SECONDS);
        return new Sound(new short[numSamples], samplingRate);
    }

    public static Sound makeEmptyBySeconds(double durationSeconds) {
        return makeEmptyBySeconds(durationSeconds, DEFAULT_SAMPLING_RATE);
    }

    public static Sound makeEmptyBySeconds(double durationSeconds, double samplingRate) {
        Preconditions.checkArgument(durationSeconds >= 0 && durationSeconds <= MAX_DURATION_SECONDS,
                "In makeEmptyBySeconds: duration must be between 0 and %s seconds, actually %s",
                MAX_DURATION_SECONDS, durationSeconds);
        Preconditions.checkArgument(samplingRate > 0, "In makeEmptyBySeconds: sampling rate must be positive, actually %s", samplingRate);
        return makeEmpty((int) (durationSeconds * samplingRate + 0.5), samplingRate);
    }

    public static Sound fromFile(String name) throws IOException {
        MediaPreconditions.checkType(name, "fromFile", "name", "String");
        return fromFile(MediaPath.resolve(name));
    }

    public static Sound fromFile(Path path) throws IOException {
        return SoundReader.readSound(path);
    }

    /**
     * Create a sound from the given samples; the array is copied.
     */
    public static Sound fromSamples(short[] samples, double samplingRate) {
        MediaPreconditions.checkType(samples, "fromSamples", "samples", "short[]");
        Preconditions.checkArgument(samplingRate > 0, "In fromSamples: sampling rate must be positive, actually %s", samplingRate);
        return new Sound(samples.clone(), samplingRate);
    }

    public static int clampSampleValue(long value) {
        return (int) Math.max(MIN_SAMPLE_VALUE, Math.min(MAX_SAMPLE_VALUE, value));
    }

    private final short[] samples;
    private final double samplingRate;

    private Sound(short[] samples, double samplingRate) {
        this.samples = samples;
        this.samplingRate = samplingRate;
    }

    public int getLength() {
        return samples.length;
    }

    public double getSamplingRate() {
        return samplingRate;
    }

    /**
     * @return the duration in seconds.
     */
    public double getDuration() {
        return samples.length / samplingRate;
    }

    public int get(int index) {
        return samples[checkIndex(index, "get")];
    }

    /**
     * Set a sample; the value is clamped to the signed 16 bit range.
     */
    public void set(int index, int value) {
        samples[checkIndex(index, "set")] = (short) clampSampleValue(value);
    }

    public Sample getSample(int index) {
        return new Sample(this, index);
    }

    /**
     * @return a copy of the sample values.
     */
    public short[] getSamples() {
        return samples.clone();
    }

    public Sound copy() {
        return new Sound(samples.clone(), samplingRate);
    }

    @Override
    public Iterator<Sample> iterator() {
        return new Iterator<Sample>() {
            private int index = 0;

            @Override
            public boolean hasNext() {
                return index < samples.length;
            }

            @Override
            public Sample next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return new Sample(Sound.this, index++);
            }
        };
    }

    public void write(String name) throws IOException {
        MediaPreconditions.checkType(name, "write", "name", "String");
        SoundWriter.writeSound(this, MediaPath.resolve(name));
    }

    private int checkIndex(int index, String operation) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("Sound." + operation + "(" + index + "): Negative index");
        }
        if (index >= samples.length) {
            throw new IndexOutOfBoundsException("Sound." + operation + "(" + index + "): Index too large, max=" + (samples.length - 1));
        }
        return index;
    }

    @Override
    public String toString() {
        return "Sound, length=" + samples.length + ", sampling rate=" + samplingRate;
    }
}
