package org.photomosaic.io.json;

/**
 * Describes where the cache lives and how its JSON object is laid out.
 * Example file:
 * { "images": ["a.png", "b.png"], "colors": [[0.1, 0.2, 0.3], [0.5, 0.5, 0.5]] }
 */
public record CacheFileFormat(String fileName, String imagesField, String colorsField) {

    public static final CacheFileFormat DEFAULT = new CacheFileFormat("dictionary_cache.json", "images", "colors");

    public CacheFileFormat {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must be non-empty");
        }
        if (fileName.contains("/") || fileName.contains("\\")) {
            throw new IllegalArgumentException("fileName must be a bare file name: " + fileName);
        }
        if (imagesField == null || imagesField.isBlank()) {
            throw new IllegalArgumentException("imagesField must be non-empty");
        }
        if (colorsField == null || colorsField.isBlank()) {
            throw new IllegalArgumentException("colorsField must be non-empty");
        }
        if (imagesField.equals(colorsField)) {
            throw new IllegalArgumentException("imagesField and colorsField must differ");
        }
    }

    public static CacheFileFormat named(String fileName) {
        return new CacheFileFormat(fileName, DEFAULT.imagesField(), DEFAULT.colorsField());
    }

    /**
     * Name of the temporary file written before the atomic rename.
     */
    public String tempFileName() {
        return "." + fileName + ".tmp";
    }
}
