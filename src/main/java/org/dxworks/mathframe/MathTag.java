package org.dxworks.mathframe;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The MathML constructs the renderer knows how to lay out.
 * Anything else maps to {@link #UNKNOWN} and is flattened horizontally.
 */
public enum MathTag {
    MATH("math"),
    MROW("mrow"),
    MI("mi"),
    MO("mo"),
    MN("mn"),
    MTEXT("mtext"),
    MSPACE("mspace"),
    MFRAC("mfrac"),
    MSUB("msub"),
    MSUP("msup"),
    MSUBSUP("msubsup"),
    MUNDER("munder"),
    MUNDEROVER("munderover"),
    MSQRT("msqrt"),
    MROOT("mroot"),
    MTABLE("mtable"),
    MTR("mtr"),
    MTD("mtd"),
    MFENCED("mfenced"),
    UNKNOWN("");

    private static final Map<String, MathTag> BY_NAME = Arrays.stream(values())
            .filter(tag -> tag != UNKNOWN)
            .collect(Collectors.toUnmodifiableMap(MathTag::getName, Function.identity()));

    private final String name;

    MathTag(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** Case-sensitive lookup by local element name. */
    public static MathTag fromName(String localName) {
        if (localName == null) {
            return UNKNOWN;
        }
        return BY_NAME.getOrDefault(localName, UNKNOWN);
    }
}
