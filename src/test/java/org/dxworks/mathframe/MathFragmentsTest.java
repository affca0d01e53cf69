package org.dxworks.mathframe;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MathFragmentsTest {

    @Test
    void findsFragmentWithAttributes() {
        String text = "<p>Energy: <math display=\"block\"><mi>E</mi></math> joules</p>";
        assertEquals(Optional.of("<math display=\"block\"><mi>E</mi></math>"), MathFragments.findFirst(text));
    }

    @Test
    void fragmentMaySpanLines() {
        String text = "before\n<math>\n  <mi>x</mi>\n</math>\nafter";
        assertEquals(Optional.of("<math>\n  <mi>x</mi>\n</math>"), MathFragments.findFirst(text));
    }

    @Test
    void stopsAtFirstClosingTag() {
        String text = "<math><mi>a</mi></math> and <math><mi>b</mi></math>";
        assertEquals(Optional.of("<math><mi>a</mi></math>"), MathFragments.findFirst(text));
    }

    @Test
    void matchesTagCaseSensitively() {
        assertTrue(MathFragments.findFirst("<MATH><mi>x</mi></MATH>").isEmpty());
        assertTrue(MathFragments.findFirst("plain text").isEmpty());
        assertTrue(MathFragments.findFirst(null).isEmpty());
    }

    @Test
    void findsAllFragmentsInOrder() {
        String text = "<math><mi>a</mi></math>, <math><mn>1</mn></math>; <math></math>";
        assertEquals(List.of("<math><mi>a</mi></math>", "<math><mn>1</mn></math>", "<math></math>"),
                MathFragments.findAll(text));
        assertTrue(MathFragments.findAll("no math").isEmpty());
    }
}
