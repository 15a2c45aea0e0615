package org.janelia.mediacomp;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Argument checks shared by the media types. A value of the wrong kind
 * (here: a missing value, since the compiler already enforces the static type)
 * is reported as an {@link IllegalArgumentException} before anything gets mutated.
 */
public class MediaPreconditions {

    public static <T> T checkType(@Nullable T value, String operation, String paramName, String expected) {
        Preconditions.checkArgument(value != null, "In %s: %s expected a %s, actually null", operation, paramName, expected);
        return value;
    }

    /**
     * Check the value returned by a caller supplied function.
     */
    public static <T> T checkResult(@Nullable T result, String operation, String functionName, String expected) {
        Preconditions.checkArgument(result != null, "In %s: the value returned by %s expected a %s, actually null",
                operation, functionName, expected);
        return result;
    }
}
