package org.janelia.mediacomp.files;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import javax.annotation.Nullable;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The directory against which relative media file names are resolved.
 * It starts as the value of the <code>mediacomp.mediaPath</code> system property,
 * or the working directory when the property is not set.
 */
public class MediaPath {

    public static final String MEDIA_PATH_PROPERTY = "mediacomp.mediaPath";

    private static final Logger LOG = LoggerFactory.getLogger(MediaPath.class);

    private static Path mediaPath = initialMediaPath();

    public static synchronized Path get() {
        return mediaPath;
    }

    /**
     * Change the media directory. A relative directory is resolved against the current media path.
     * A null directory resets the media path to the working directory.
     *
     * @return false, leaving the media path unchanged, if the target is not a directory
     */
    public static synchronized boolean set(@Nullable String dir) {
        if (dir == null) {
            mediaPath = workingDirectory();
            LOG.debug("Media path reset to {}", mediaPath);
            return true;
        }
        Path newPath = mediaPath.resolve(dir).normalize();
        if (Files.isDirectory(newPath)) {
            mediaPath = newPath;
            LOG.debug("Media path set to {}", mediaPath);
            return true;
        } else {
            LOG.warn("Media path not changed - {} is not a directory", newPath);
            return false;
        }
    }

    /**
     * @return the name resolved against the media path; absolute names are returned as they are.
     */
    public static synchronized Path resolve(String name) {
        return mediaPath.resolve(name);
    }

    private static Path initialMediaPath() {
        String mediaPathProperty = System.getProperty(MEDIA_PATH_PROPERTY);
        if (StringUtils.isNotBlank(mediaPathProperty)) {
            return Paths.get(mediaPathProperty).toAbsolutePath();
        } else {
            return workingDirectory();
        }
    }

    private static Path workingDirectory() {
        return Paths.get("").toAbsolutePath();
    }
}
