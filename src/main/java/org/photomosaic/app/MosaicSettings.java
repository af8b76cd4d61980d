package org.photomosaic.app;

import org.photomosaic.color.ComparisonSpace;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Defaults of the tool, read from the classpath resource {@code photomosaic.properties}.
 * Every key can be overridden with a system property prefixed by {@code photomosaic.}.
 */
public record MosaicSettings(int tilePixels, String cacheFile, int workers,
                             ComparisonSpace comparisonSpace, String defaultOutput) {

    static final String RESOURCE = "photomosaic.properties";
    static final String OVERRIDE_PREFIX = "photomosaic.";

    public MosaicSettings {
        if (tilePixels <= 0) {
            throw new IllegalArgumentException("tile.pixels must be >= 1");
        }
        if (cacheFile == null || cacheFile.isBlank()) {
            throw new IllegalArgumentException("cache.file must be non-empty");
        }
        if (comparisonSpace == null) {
            throw new IllegalArgumentException("comparison.space must not be null");
        }
        if (defaultOutput == null || defaultOutput.isBlank()) {
            throw new IllegalArgumentException("output.default must be non-empty");
        }
    }

    public static MosaicSettings defaults() {
        return new MosaicSettings(32, "dictionary_cache.json", 0, ComparisonSpace.CIELAB, "output.png");
    }

    /**
     * Loads the bundled resource and applies system property overrides.
     */
    public static MosaicSettings load() {
        Properties props = new Properties();
        try (InputStream in = MosaicSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(OVERRIDE_PREFIX)) {
                props.setProperty(key.substring(OVERRIDE_PREFIX.length()), System.getProperty(key));
            }
        }
        return from(props);
    }

    /**
     * Missing keys fall back to {@link #defaults()}.
     */
    public static MosaicSettings from(Properties props) {
        MosaicSettings d = defaults();
        return new MosaicSettings(
                intValue(props, "tile.pixels", d.tilePixels()),
                props.getProperty("cache.file", d.cacheFile()).strip(),
                intValue(props, "workers", d.workers()),
                props.containsKey("comparison.space")
                        ? ComparisonSpace.parse(props.getProperty("comparison.space"))
                        : d.comparisonSpace(),
                props.getProperty("output.default", d.defaultOutput()).strip()
        );
    }

    private static int intValue(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + key + "' must be an integer: " + raw, e);
        }
    }
}
