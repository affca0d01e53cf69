package org.dxworks.mathframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class MathframeConfig {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final boolean DEFAULT_USE_UNICODE = true;
    private static final String CONFIG_FILE_NAME = "mathframe-config.yml";

    private final boolean useUnicode;
    private final int maxNestingDepth;
    private final int maxFileLines;

    private MathframeConfig(boolean useUnicode, int maxNestingDepth, int maxFileLines) {
        this.useUnicode = useUnicode;
        this.maxNestingDepth = maxNestingDepth;
        this.maxFileLines = maxFileLines;
    }

    public boolean isUseUnicode() {
        return useUnicode;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public static MathframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MathframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                boolean effectiveUseUnicode = (yamlConfig.useUnicode != null)
                        ? yamlConfig.useUnicode
                        : DEFAULT_USE_UNICODE;
                int effectiveMaxNestingDepth = (yamlConfig.maxNestingDepth != null)
                        ? yamlConfig.maxNestingDepth
                        : DEFAULT_MAX_NESTING_DEPTH;
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;

                return with(effectiveUseUnicode, effectiveMaxNestingDepth, effectiveMaxFileLines);
            }
        } catch (IOException e) {
            // Fall through to default
        }

        return defaults();
    }

    public static MathframeConfig defaults() {
        return new MathframeConfig(DEFAULT_USE_UNICODE, DEFAULT_MAX_NESTING_DEPTH, DEFAULT_MAX_FILE_LINES);
    }

    public static MathframeConfig with(boolean useUnicode, int maxNestingDepth, int maxFileLines) {
        int effectiveMaxNestingDepth = maxNestingDepth > 0 ? maxNestingDepth : DEFAULT_MAX_NESTING_DEPTH;
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new MathframeConfig(useUnicode, effectiveMaxNestingDepth, effectiveMaxFileLines);
    }

    private static class YamlConfig {
        public Boolean useUnicode;
        public Integer maxNestingDepth;
        public Integer maxFileLines;
    }
}
