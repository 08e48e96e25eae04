package dk.trustworks.documentassembly.template;

import java.util.regex.Pattern;

/**
 * Decides which parts of a word-processing package carry fillable body text.
 * Styles, relationships, media, settings and the content-type manifest never qualify.
 */
public final class TemplatePartFilter {

    private static final Pattern TRANSFORMABLE = Pattern.compile(
            "word/(?:document|header|footer)[^/]*\\.xml|word/(?:footnotes|endnotes)\\.xml");

    private TemplatePartFilter() {
    }

    public static boolean isTransformable(String entryName) {
        return entryName != null && TRANSFORMABLE.matcher(entryName).matches();
    }
}
