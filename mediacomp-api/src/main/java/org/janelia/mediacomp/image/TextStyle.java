package org.janelia.mediacomp.image;

import java.awt.Font;
import java.awt.GraphicsEnvironment;
import java.util.Arrays;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;
import org.janelia.mediacomp.MediaPreconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Font, emphasis and point size used to draw text on a picture.
 * When no installed font family matches the requested name the logical {@link Font#DIALOG} font is used.
 */
public class TextStyle {

    private static final Logger LOG = LoggerFactory.getLogger(TextStyle.class);

    public enum Emphasis {
        PLAIN(Font.PLAIN),
        BOLD(Font.BOLD),
        ITALIC(Font.ITALIC),
        BOLD_ITALIC(Font.BOLD | Font.ITALIC);

        private final int fontStyle;

        Emphasis(int fontStyle) {
            this.fontStyle = fontStyle;
        }

        public int getFontStyle() {
            return fontStyle;
        }

        /**
         * Parse descriptions such as "bold", "italic" or "bold + italic"; anything else is plain.
         */
        public static Emphasis fromName(@Nullable String name) {
            boolean bold = StringUtils.containsIgnoreCase(name, "bold");
            boolean italic = StringUtils.containsIgnoreCase(name, "italic");
            if (bold && italic) {
                return BOLD_ITALIC;
            } else if (bold) {
                return BOLD;
            } else if (italic) {
                return ITALIC;
            } else {
                return PLAIN;
            }
        }
    }

    /**
     * @return the first installed font family whose name contains the query (case insensitive) or null
     */
    @Nullable
    public static String findFontFamily(@Nullable String query) {
        if (StringUtils.isBlank(query)) {
            return null;
        }
        String[] families = GraphicsEnvironment.getLocalGraphicsEnvironment().getAvailableFontFamilyNames();
        return Arrays.stream(families)
                .filter(family -> StringUtils.containsIgnoreCase(family, query))
                .findFirst()
                .orElse(null);
    }

    private final String fontName;
    private final Emphasis emphasis;
    private final float size;
    private final Font font;

    public TextStyle(String fontName, Emphasis emphasis, float size) {
        this.fontName = MediaPreconditions.checkType(fontName, "TextStyle", "fontName", "String");
        this.emphasis = MediaPreconditions.checkType(emphasis, "TextStyle", "emphasis", "Emphasis");
        Preconditions.checkArgument(size > 0, "In TextStyle: size must be positive, actually %s", size);
        this.size = size;
        String family = findFontFamily(fontName);
        if (family == null) {
            LOG.debug("No installed font matches '{}' - using {}", fontName, Font.DIALOG);
            family = Font.DIALOG;
        }
        this.font = new Font(family, emphasis.getFontStyle(), 1).deriveFont(size);
    }

    public TextStyle(String fontName, String emphasis, float size) {
        this(fontName, Emphasis.fromName(emphasis), size);
    }

    public String getFontName() {
        return fontName;
    }

    public Emphasis getEmphasis() {
        return emphasis;
    }

    public float getSize() {
        return size;
    }

    public Font getFont() {
        return font;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("fontName", fontName)
                .append("emphasis", emphasis)
                .append("size", size)
                .toString();
    }
}
