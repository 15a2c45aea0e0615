package org.janelia.mediacomp.color;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.StringUtils;

/**
 * Named color constants.
 */
public class Colors {
    public static final Color WHITE = new Color(255, 255, 255);
    public static final Color BLACK = new Color(0, 0, 0);
    public static final Color BLUE = new Color(0, 0, 255);
    public static final Color RED = new Color(255, 0, 0);
    public static final Color GREEN = new Color(0, 255, 0);
    public static final Color GRAY = new Color(128, 128, 128);
    public static final Color DARK_GRAY = new Color(64, 64, 64);
    public static final Color LIGHT_GRAY = new Color(192, 192, 192);
    public static final Color YELLOW = new Color(255, 255, 0);
    public static final Color ORANGE = new Color(255, 200, 0);
    public static final Color PINK = new Color(255, 175, 175);
    public static final Color MAGENTA = new Color(255, 0, 255);
    public static final Color CYAN = new Color(0, 255, 255);

    private static final Map<String, Color> COLORS_BY_NAME = ImmutableMap.<String, Color>builder()
            .put("white", WHITE)
            .put("black", BLACK)
            .put("blue", BLUE)
            .put("red", RED)
            .put("green", GREEN)
            .put("gray", GRAY)
            .put("darkgray", DARK_GRAY)
            .put("lightgray", LIGHT_GRAY)
            .put("yellow", YELLOW)
            .put("orange", ORANGE)
            .put("pink", PINK)
            .put("magenta", MAGENTA)
            .put("cyan", CYAN)
            .build();

    /**
     * Lookup a named color; the name is case insensitive and may use "_" as in "dark_gray".
     *
     * @param name
     * @return the color or null if the name is not known
     */
    @Nullable
    public static Color byName(@Nullable String name) {
        if (StringUtils.isBlank(name)) {
            return null;
        }
        return COLORS_BY_NAME.get(StringUtils.remove(name.trim().toLowerCase(), '_'));
    }
}
