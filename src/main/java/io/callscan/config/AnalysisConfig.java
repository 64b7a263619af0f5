package io.callscan.config;

import io.callscan.model.ExternalFunctionInfo;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Analysis settings loaded from a YAML file.
 * All keys are optional.
 */
public class AnalysisConfig {

    /** Cap for the indirect recursion walk; a capped result means "at least this deep". */
    public static final int DEFAULT_MAX_INDIRECT_DEPTH = 100;

    /** Outgoing call count above which a non-recursive function is drawn as a hub. */
    public static final int DEFAULT_HUB_CALL_THRESHOLD = 5;

    private final int maxIndirectDepth;
    private final int hubCallThreshold;
    private final ExternalFunctionCatalog catalog;

    private AnalysisConfig(int maxIndirectDepth, int hubCallThreshold, ExternalFunctionCatalog catalog) {
        this.maxIndirectDepth = maxIndirectDepth;
        this.hubCallThreshold = hubCallThreshold;
        this.catalog = catalog;
    }

    /**
     * Default settings with the built-in catalog.
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(DEFAULT_MAX_INDIRECT_DEPTH, DEFAULT_HUB_CALL_THRESHOLD,
                ExternalFunctionCatalog.defaultCatalog());
    }

    /**
     * Load configuration from a YAML file. Catalog entries in the file are merged
     * over the built-in catalog.
     */
    public static AnalysisConfig load(Path configPath) throws IOException {
        Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(configPath)) {
            Object loaded = yaml.load(in);
            if (loaded == null) {
                return defaults();
            }
            if (!(loaded instanceof Map<?, ?> data)) {
                throw new IOException("Config file must contain a mapping: " + configPath);
            }

            int maxIndirectDepth = readNonNegative(data, "maxIndirectDepth", DEFAULT_MAX_INDIRECT_DEPTH);
            int hubCallThreshold = readNonNegative(data, "hubCallThreshold", DEFAULT_HUB_CALL_THRESHOLD);

            ExternalFunctionCatalog catalog = ExternalFunctionCatalog.defaultCatalog();
            try {
                List<ExternalFunctionInfo> extra =
                        ExternalFunctionCatalog.parseEntries(data.get("externalFunctions"));
                if (!extra.isEmpty()) {
                    catalog = catalog.merge(ExternalFunctionCatalog.of(extra));
                }
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid 'externalFunctions' in " + configPath + ": " + e.getMessage(), e);
            }

            return new AnalysisConfig(maxIndirectDepth, hubCallThreshold, catalog);
        }
    }

    private static int readNonNegative(Map<?, ?> data, String key, int defaultValue) throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Number number)) {
            throw new IOException("Config key '" + key + "' must be a number, got: " + value);
        }
        int result = number.intValue();
        if (result < 0) {
            throw new IOException("Config key '" + key + "' must not be negative, got: " + result);
        }
        return result;
    }

    /**
     * Returns a copy with a different indirect depth cap.
     */
    public AnalysisConfig withMaxIndirectDepth(int maxIndirectDepth) {
        if (maxIndirectDepth < 0) {
            throw new IllegalArgumentException("maxIndirectDepth must not be negative");
        }
        return new AnalysisConfig(maxIndirectDepth, hubCallThreshold, catalog);
    }

    /**
     * Returns a copy with a different hub threshold.
     */
    public AnalysisConfig withHubCallThreshold(int hubCallThreshold) {
        if (hubCallThreshold < 0) {
            throw new IllegalArgumentException("hubCallThreshold must not be negative");
        }
        return new AnalysisConfig(maxIndirectDepth, hubCallThreshold, catalog);
    }

    /**
     * Returns a copy using the given catalog.
     */
    public AnalysisConfig withCatalog(ExternalFunctionCatalog catalog) {
        return new AnalysisConfig(maxIndirectDepth, hubCallThreshold, catalog);
    }

    public int getMaxIndirectDepth() {
        return maxIndirectDepth;
    }

    public int getHubCallThreshold() {
        return hubCallThreshold;
    }

    public ExternalFunctionCatalog getCatalog() {
        return catalog;
    }
}
