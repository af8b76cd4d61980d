package org.photomosaic.io;

import org.photomosaic.error.DecodeFailureException;
import org.photomosaic.error.EncodeFailureException;
import org.photomosaic.model.PixelGrid;
import org.photomosaic.model.PixelGrids;
import org.photomosaic.model.RgbPixelGrid;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * {@link ImageCodec} on top of {@code javax.imageio}.
 * Every decoded image is normalized once into an {@link RgbPixelGrid} of packed 0xRRGGBB values
 * (gray replicated, alpha dropped), so color means, resizing and lookups all read the same pixels.
 */
public final class ImageIoCodec implements ImageCodec {

    private static final String DEFAULT_FORMAT = "png";

    @Override
    public PixelGrid decode(Path path) {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new DecodeFailureException("Could not read image", path);
        }

        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException | RuntimeException e) {
            throw new DecodeFailureException("Invalid image: " + e.getMessage(), path, e);
        }
        if (image == null) {
            throw new DecodeFailureException("Invalid image: no decoder for this format", path);
        }
        return RgbPixelGrid.copyOf(image);
    }

    @Override
    public void encode(PixelGrid grid, Path path) {
        if (grid == null) throw new IllegalArgumentException("grid must not be null");
        if (path == null) throw new IllegalArgumentException("path must not be null");
        if (grid.pixelCount() == 0) {
            throw new EncodeFailureException("Cannot encode an empty " + grid.width() + "x" + grid.height() + " image", path);
        }

        String format = formatOf(path);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!ImageIO.write(PixelGrids.toImage(grid), format, path.toFile())) {
                throw new EncodeFailureException("No image writer for format '" + format + "'", path);
            }
        } catch (IOException e) {
            throw new EncodeFailureException("Could not write image: " + e.getMessage(), path, e);
        }
    }

    static String formatOf(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return DEFAULT_FORMAT;
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return ext.equals("jpeg") ? "jpg" : ext;
    }
}
