package org.dxworks.mathframe.renderer.script;

import org.dxworks.mathframe.renderer.MathTextUtils;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Unicode subscript and superscript glyph tables.
 * A conversion succeeds only when every character has a glyph; one unmappable character
 * rejects the whole text.
 */
public final class UnicodeScripts {

    private static final Map<Integer, Integer> SUBSCRIPTS = table(
            "0₀", "1₁", "2₂", "3₃", "4₄", "5₅", "6₆", "7₇", "8₈", "9₉",
            "aₐ", "eₑ", "iᵢ", "jⱼ", "oₒ", "uᵤ", "xₓ", "hₕ", "kₖ", "lₗ",
            "mₘ", "nₙ", "pₚ", "rᵣ", "sₛ", "tₜ", "vᵥ",
            "+₊", "-₋", "=₌", "(₍", ")₎", "əₔ",
            ",,", "  ");

    private static final Map<Integer, Integer> SUPERSCRIPTS = table(
            "0⁰", "1¹", "2²", "3³", "4⁴", "5⁵", "6⁶", "7⁷", "8⁸", "9⁹",
            "aᵃ", "bᵇ", "cᶜ", "dᵈ", "eᵉ", "fᶠ", "gᵍ", "hʰ", "iⁱ", "jʲ",
            "kᵏ", "lˡ", "mᵐ", "nⁿ", "oᵒ", "pᵖ", "rʳ", "sˢ", "tᵗ", "uᵘ",
            "vᵛ", "wʷ", "xˣ", "yʸ", "zᶻ",
            "Aᴬ", "Bᴮ", "Dᴰ", "Eᴱ", "Gᴳ", "Hᴴ", "Iᴵ", "Jᴶ", "Kᴷ", "Lᴸ",
            "Mᴹ", "Nᴺ", "Oᴼ", "Pᴾ", "Rᴿ", "Tᵀ", "Uᵁ", "Vⱽ", "Wᵂ",
            "+⁺", "-⁻", "=⁼", "(⁽", ")⁾",
            "θᶿ", "'′", "⊺ᵀ", "  ", "*·");

    /** Already superscript-sized; used as they are. */
    private static final Set<Integer> INLINE_SUPERSCRIPT_SYMBOLS = Set.of(
            (int) '′', (int) '″', (int) '‴', (int) '†', (int) '‡', (int) '°');

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SUPERSCRIPT_OPERATORS = Pattern.compile("[*/=]");

    private UnicodeScripts() {}

    public static Optional<String> trySubscript(String text, boolean useUnicode) {
        if (!useUnicode || text == null || text.isEmpty()) {
            return Optional.empty();
        }
        return convert(text, SUBSCRIPTS, Set.of());
    }

    /**
     * Superscript conversion. Text containing {@code * / =} loses all whitespace so the
     * operators read tightly; other text keeps single spaces between words.
     */
    public static Optional<String> trySuperscript(String text, boolean useUnicode) {
        if (!useUnicode || text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String stripped = MathTextUtils.trim(text);
        String normalized = SUPERSCRIPT_OPERATORS.matcher(text).find()
                ? WHITESPACE.matcher(stripped).replaceAll("")
                : WHITESPACE.matcher(stripped).replaceAll(" ");
        return convert(normalized, SUPERSCRIPTS, INLINE_SUPERSCRIPT_SYMBOLS);
    }

    private static Optional<String> convert(String text, Map<Integer, Integer> glyphs, Set<Integer> passThrough) {
        StringBuilder sb = new StringBuilder(text.length());
        int[] codePoints = text.codePoints().toArray();
        for (int cp : codePoints) {
            Integer mapped = glyphs.get(cp);
            if (mapped != null) {
                sb.appendCodePoint(mapped);
            } else if (passThrough.contains(cp)) {
                sb.appendCodePoint(cp);
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(sb.toString());
    }

    /** Builds a table from two-character "from, to" pairs. */
    private static Map<Integer, Integer> table(String... pairs) {
        Map<Integer, Integer> map = new HashMap<>();
        for (String pair : pairs) {
            int[] cps = pair.codePoints().toArray();
            map.put(cps[0], cps[1]);
        }
        return Map.copyOf(map);
    }
}
