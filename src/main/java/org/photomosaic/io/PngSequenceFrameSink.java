package org.photomosaic.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.photomosaic.error.EncodeFailureException;
import org.photomosaic.model.PixelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes composed frames as {@code frame-00000.png, frame-00001.png, ...} into a directory,
 * plus a {@code sequence.json} descriptor (frame rate, size, count) when closed.
 */
public final class PngSequenceFrameSink implements FrameSink {

    private static final Logger logger = LoggerFactory.getLogger(PngSequenceFrameSink.class);
    static final String DESCRIPTOR = "sequence.json";

    private final Path directory;
    private final double frameRate;
    private final ImageCodec codec;

    private int count;
    private int width;
    private int height;
    private boolean closed;

    public PngSequenceFrameSink(Path directory, double frameRate, ImageCodec codec) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        if (!(frameRate > 0) || Double.isInfinite(frameRate)) {
            throw new IllegalArgumentException("frameRate must be positive: " + frameRate);
        }
        this.frameRate = frameRate;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new EncodeFailureException("Could not create frame directory", directory, e);
        }
    }

    public static String frameName(int index) {
        return String.format("frame-%05d.png", index);
    }

    @Override
    public void append(PixelGrid frame) {
        if (closed) throw new IllegalStateException("Frame sink is closed: " + directory);
        Objects.requireNonNull(frame, "frame must not be null");
        if (count > 0 && (frame.width() != width || frame.height() != height)) {
            throw new IllegalArgumentException("Frame " + count + " is " + frame.width() + "x" + frame.height()
                    + " but the sequence is " + width + "x" + height);
        }
        codec.encode(frame, directory.resolve(frameName(count)));
        width = frame.width();
        height = frame.height();
        count++;
    }

    @Override
    public int frameCount() {
        return count;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("frameRate", frameRate);
        descriptor.put("width", width);
        descriptor.put("height", height);
        descriptor.put("frames", count);
        descriptor.put("pattern", "frame-%05d.png");

        Path file = directory.resolve(DESCRIPTOR);
        try {
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT).writeValue(file.toFile(), descriptor);
        } catch (IOException e) {
            throw new EncodeFailureException("Could not write sequence descriptor", file, e);
        }
        logger.info("Wrote {} frames to {}", count, directory);
    }
}
