package org.dxworks.mathframe;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates {@code <math>...</math>} fragments embedded in free text such as HTML or Markdown.
 * Matching is case-sensitive and non-greedy, so each fragment ends at the first closing tag.
 */
public class MathFragments {

    private static final Pattern MATH_ELEMENT = Pattern.compile("(?s)<math[^>]*>.*?</math>");

    public static Optional<String> findFirst(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = MATH_ELEMENT.matcher(text);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    public static List<String> findAll(String text) {
        List<String> fragments = new ArrayList<>();
        if (text == null) {
            return fragments;
        }
        Matcher matcher = MATH_ELEMENT.matcher(text);
        while (matcher.find()) {
            fragments.add(matcher.group());
        }
        return fragments;
    }
}
