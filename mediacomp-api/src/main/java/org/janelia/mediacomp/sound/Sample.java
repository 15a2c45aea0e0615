package org.janelia.mediacomp.sound;

import com.google.common.base.Preconditions;
import org.janelia.mediacomp.MediaPreconditions;

/**
 * Live view of one sample of a sound.
 */
public class Sample {

    private final Sound sound;
    private final int index;

    public Sample(Sound sound, int index) {
        this.sound = MediaPreconditions.checkType(sound, "Sample", "sound", "Sound");
        Preconditions.checkArgument(index >= 0 && index < sound.getLength(),
                "In Sample: index %s is outside [0, %s)", index, sound.getLength());
        this.index = index;
    }

    public Sound getSound() {
        return sound;
    }

    public int getIndex() {
        return index;
    }

    public int getValue() {
        return sound.get(index);
    }

    public void setValue(int value) {
        sound.set(index, value);
    }

    @Override
    public String toString() {
        return "Sample at " + index + " with value " + getValue();
    }
}
