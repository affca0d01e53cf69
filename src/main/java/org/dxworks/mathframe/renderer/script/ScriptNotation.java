package org.dxworks.mathframe.renderer.script;

import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.MathTextUtils;

import java.util.Optional;

/**
 * Inline renderings of scripts, tried before falling back to a stacked layout:
 * Unicode script glyphs first, then the compact {@code base_sub} / {@code base^sup} notation.
 */
final class ScriptNotation {

    /** Longest flattened subscript still written inline (in UTF-8 bytes). */
    static final int SUBSCRIPT_FLATTEN_LIMIT = 20;
    /** Same bound when a superscript is present too. */
    static final int SUBSUP_FLATTEN_LIMIT = 10;
    static final int COMPACT_SUBSCRIPT_LIMIT = 20;
    static final int COMPACT_SUPERSCRIPT_LIMIT = 2;

    private ScriptNotation() {}

    /**
     * Text of a subscript box: its only row, or all rows flattened when that stays within
     * {@code flattenLimit}. Empty when the box is too large to be written inline.
     */
    static String subscriptText(MathBox subscript, int flattenLimit) {
        if (MathTextUtils.isInline(subscript)) {
            return MathTextUtils.firstRow(subscript);
        }
        String flattened = MathTextUtils.flatten(subscript);
        return MathTextUtils.utf8Length(flattened) <= flattenLimit ? flattened : "";
    }

    /** Superscripts are only written inline when they are a single row. */
    static String superscriptText(MathBox superscript) {
        return MathTextUtils.isInline(superscript) ? MathTextUtils.firstRow(superscript) : "";
    }

    static Optional<MathBox> inlineSubscript(MathBox base, String subscriptText, boolean useUnicode) {
        String baseText = MathTextUtils.firstRow(base);
        Optional<String> unicode = UnicodeScripts.trySubscript(subscriptText, useUnicode);
        if (unicode.isPresent()) {
            return Optional.of(MathBox.fromText(baseText + unicode.get()));
        }
        if (isCompactSubscript(subscriptText)) {
            return Optional.of(MathBox.fromText(baseText + "_" + subscriptText));
        }
        return Optional.empty();
    }

    static Optional<MathBox> inlineSuperscript(MathBox base, String superscriptText, boolean useUnicode) {
        String baseText = MathTextUtils.firstRow(base);
        Optional<String> unicode = UnicodeScripts.trySuperscript(superscriptText, useUnicode);
        if (unicode.isPresent()) {
            return Optional.of(MathBox.fromText(baseText + unicode.get()));
        }
        if (isCompactSuperscript(superscriptText)) {
            return Optional.of(MathBox.fromText(baseText + "^" + superscriptText));
        }
        return Optional.empty();
    }

    static boolean isCompactSubscript(String text) {
        return MathTextUtils.utf8Length(text) <= COMPACT_SUBSCRIPT_LIMIT
                && text.codePoints().allMatch(cp -> MathTextUtils.isAlphanumeric(cp)
                        || cp == '-' || cp == '+' || cp == '/' || cp == ' ');
    }

    static boolean isCompactSuperscript(String text) {
        return MathTextUtils.utf8Length(text) <= COMPACT_SUPERSCRIPT_LIMIT
                && text.codePoints().allMatch(MathTextUtils::isAlphanumeric);
    }
}
