package org.dxworks.mathframe;

import java.nio.file.Path;
import java.util.Set;

/** Decides which files may carry MathML worth rendering. */
public class InputDetector {

    private static final Set<String> EXTENSIONS = Set.of(
            ".html", ".htm", ".xhtml", ".xml", ".mml", ".txt", ".md");

    public static boolean isSupported(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && EXTENSIONS.contains(name.substring(dot));
    }
}
