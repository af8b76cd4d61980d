package org.photomosaic.io.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.photomosaic.error.CorruptCacheException;
import org.photomosaic.io.TileCache;
import org.photomosaic.model.Color3f;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON implementation of {@link TileCache}.
 *
 * Expected JSON shape: one object with two parallel arrays
 * {
 *   "images": [ "a.png", "sub/b.png" ],
 *   "colors": [ [0.21, 0.40, 0.05], [0.9, 0.9, 0.9] ]
 * }
 * Colors are linear RGB means. The file is rewritten through a temporary file and a rename.
 */
public final class JsonTileCache implements TileCache {

    private static final Logger logger = LoggerFactory.getLogger(JsonTileCache.class);

    private final CacheFileFormat format;
    private final JsonFactory factory;

    public JsonTileCache(CacheFileFormat format) {
        this.format = Objects.requireNonNull(format, "format must not be null");
        this.factory = new ObjectMapper().getFactory();
    }

    public JsonTileCache() {
        this(CacheFileFormat.DEFAULT);
    }

    public Path cacheFile(Path sourceRoot) {
        return sourceRoot.resolve(format.fileName());
    }

    @Override
    public boolean owns(Path file) {
        Path name = file.getFileName();
        if (name == null) return false;
        String n = name.toString();
        return n.equals(format.fileName()) || n.equals(format.tempFileName());
    }

    @Override
    public Map<String, Color3f> load(Path sourceRoot) {
        Objects.requireNonNull(sourceRoot, "sourceRoot must not be null");
        Path file = cacheFile(sourceRoot);
        if (!Files.exists(file)) {
            return Map.of();
        }

        try (InputStream in = Files.newInputStream(file);
             JsonParser p = factory.createParser(in)) {
            Map<String, Color3f> entries = parse(p, file);
            logger.debug("Read {} cached colors from {}", entries.size(), file);
            return entries;
        } catch (JsonProcessingException e) {
            throw new CorruptCacheException("Malformed dictionary cache: " + e.getOriginalMessage(), file, e);
        } catch (IOException e) {
            throw new CorruptCacheException("Could not read dictionary cache", file, e);
        }
    }

    private Map<String, Color3f> parse(JsonParser p, Path file) throws IOException {
        if (p.nextToken() != JsonToken.START_OBJECT) {
            throw new CorruptCacheException("Dictionary cache must be a JSON object", file);
        }

        List<String> images = null;
        List<Color3f> colors = null;

        while (p.nextToken() != JsonToken.END_OBJECT) {
            String field = p.currentName();
            p.nextToken(); // move to value

            if (format.imagesField().equals(field)) {
                images = readImages(p, file);
            } else if (format.colorsField().equals(field)) {
                colors = readColors(p, file);
            } else {
                // Skip unknown fields cleanly
                p.skipChildren();
            }
        }

        if (images == null) {
            throw new CorruptCacheException("Missing field '" + format.imagesField() + "'", file);
        }
        if (colors == null) {
            throw new CorruptCacheException("Missing field '" + format.colorsField() + "'", file);
        }
        if (images.size() != colors.size()) {
            throw new CorruptCacheException(
                    "Cache lists " + images.size() + " images but " + colors.size() + " colors", file);
        }

        Map<String, Color3f> result = new LinkedHashMap<>();
        for (int i = 0; i < images.size(); i++) {
            // No duplicate identities
            if (result.putIfAbsent(images.get(i), colors.get(i)) != null) {
                throw new CorruptCacheException("Duplicate image in cache: " + images.get(i), file);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private static List<String> readImages(JsonParser p, Path file) throws IOException {
        if (p.currentToken() != JsonToken.START_ARRAY) {
            throw new CorruptCacheException("Images field must be a JSON array of strings", file);
        }
        List<String> images = new ArrayList<>();
        while (p.nextToken() != JsonToken.END_ARRAY) {
            if (p.currentToken() != JsonToken.VALUE_STRING) {
                throw new CorruptCacheException("Images array must contain strings only", file);
            }
            String id = p.getText();
            if (id.isBlank()) {
                throw new CorruptCacheException("Blank image identity in cache", file);
            }
            images.add(id);
        }
        return images;
    }

    private static List<Color3f> readColors(JsonParser p, Path file) throws IOException {
        if (p.currentToken() != JsonToken.START_ARRAY) {
            throw new CorruptCacheException("Colors field must be a JSON array", file);
        }
        List<Color3f> colors = new ArrayList<>();
        while (p.nextToken() != JsonToken.END_ARRAY) {
            if (p.currentToken() != JsonToken.START_ARRAY) {
                throw new CorruptCacheException("Each color must be an array of " + Color3f.CHANNELS + " numbers", file);
            }
            float[] channels = new float[Color3f.CHANNELS];
            int size = 0;
            while (p.nextToken() != JsonToken.END_ARRAY) {
                if (!p.currentToken().isNumeric()) {
                    throw new CorruptCacheException("Color channels must be numbers", file);
                }
                if (size == Color3f.CHANNELS) {
                    throw new CorruptCacheException("Color has more than " + Color3f.CHANNELS + " channels", file);
                }
                channels[size++] = p.getFloatValue();
            }
            if (size != Color3f.CHANNELS) {
                throw new CorruptCacheException("Color has " + size + " channels, expected " + Color3f.CHANNELS, file);
            }
            Color3f color = Color3f.of(channels);
            if (!color.isFinite()) {
                throw new CorruptCacheException("Color channels must be finite: " + color, file);
            }
            colors.add(color);
        }
        return colors;
    }

    @Override
    public void save(Path sourceRoot, Map<String, Color3f> entries) {
        Objects.requireNonNull(sourceRoot, "sourceRoot must not be null");
        Objects.requireNonNull(entries, "entries must not be null");

        Path target = cacheFile(sourceRoot);
        Path temp = sourceRoot.resolve(format.tempFileName());
        try {
            try (OutputStream out = Files.newOutputStream(temp);
                 JsonGenerator g = factory.createGenerator(out)) {
                g.useDefaultPrettyPrinter();
                write(g, entries);
            }
            move(temp, target);
            logger.info("Saved {} colors to {}", entries.size(), target);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw new UncheckedIOException("Failed to write dictionary cache " + target, e);
        }
    }

    private void write(JsonGenerator g, Map<String, Color3f> entries) throws IOException {
        g.writeStartObject();

        g.writeArrayFieldStart(format.imagesField());
        for (String id : entries.keySet()) {
            g.writeString(id);
        }
        g.writeEndArray();

        g.writeArrayFieldStart(format.colorsField());
        for (Color3f color : entries.values()) {
            g.writeStartArray();
            g.writeNumber(color.c0());
            g.writeNumber(color.c1());
            g.writeNumber(color.c2());
            g.writeEndArray();
        }
        g.writeEndArray();

        g.writeEndObject();
    }

    private static void move(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
