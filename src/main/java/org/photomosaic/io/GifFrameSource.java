package org.photomosaic.io;

import org.photomosaic.error.DecodeFailureException;
import org.photomosaic.model.PixelGrid;
import org.photomosaic.model.RasterPixelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.NodeList;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;

/**
 * Reads the frames of an animated GIF one at a time.
 * Partial frames are drawn onto a persistent canvas so every returned frame is complete.
 */
public final class GifFrameSource implements FrameSource {

    private static final Logger logger = LoggerFactory.getLogger(GifFrameSource.class);
    private static final int DEFAULT_DELAY_MS = 100;

    private final Path path;
    private final ImageInputStream input;
    private final ImageReader reader;
    private final int frameCount;
    private final BufferedImage canvas;
    private final double frameRate;

    private int next;
    private boolean closed;

    private GifFrameSource(Path path, ImageInputStream input, ImageReader reader) throws IOException {
        this.path = path;
        this.input = input;
        this.reader = reader;
        this.frameCount = reader.getNumImages(true);
        if (frameCount <= 0) {
            throw new DecodeFailureException("GIF contains no frames", path);
        }

        BufferedImage first = reader.read(0);
        int[] screen = logicalScreen(reader);
        int w = screen[0] > 0 ? screen[0] : first.getWidth();
        int h = screen[1] > 0 ? screen[1] : first.getHeight();
        this.canvas = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        this.frameRate = 1000.0 / delayOf(reader, 0);
    }

    /**
     * Opens a GIF file for sequential reading.
     *
     * @throws DecodeFailureException if the file is not a readable GIF
     */
    public static GifFrameSource open(Path path) {
        Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("gif");
        if (!readers.hasNext()) {
            throw new DecodeFailureException("No GIF decoder available", path);
        }
        return open(path, readers.next());
    }

    /**
     * Opens the file with the given reader. The reader is disposed if opening fails,
     * otherwise it is owned by the returned source.
     */
    static GifFrameSource open(Path path, ImageReader reader) {
        ImageInputStream in = null;
        try {
            in = ImageIO.createImageInputStream(path.toFile());
            if (in == null) {
                throw new DecodeFailureException("Could not read video", path);
            }
            reader.setInput(in, false, false);
            return new GifFrameSource(path, in, reader);
        } catch (IOException | RuntimeException e) {
            reader.dispose();
            closeQuietly(in, e);
            if (e instanceof DecodeFailureException d) {
                throw d;
            }
            throw new DecodeFailureException("Invalid video: " + e.getMessage(), path, e);
        }
    }

    @Override
    public double frameRate() {
        return frameRate;
    }

    @Override
    public int width() {
        return canvas.getWidth();
    }

    @Override
    public int height() {
        return canvas.getHeight();
    }

    public int frameCount() {
        return frameCount;
    }

    @Override
    public Optional<PixelGrid> nextFrame() {
        if (closed) {
            throw new IllegalStateException("Frame source is closed: " + path);
        }
        if (next >= frameCount) {
            return Optional.empty();
        }

        int index = next++;
        try {
            BufferedImage raw = reader.read(index);
            IIOMetadataNode root = nativeTree(reader.getImageMetadata(index));
            int x = intAttribute(root, "ImageDescriptor", "imageLeftPosition");
            int y = intAttribute(root, "ImageDescriptor", "imageTopPosition");
            String disposal = attribute(root, "GraphicControlExtension", "disposalMethod");

            Graphics2D g = canvas.createGraphics();
            try {
                g.drawImage(raw, x, y, null);
            } finally {
                g.dispose();
            }

            BufferedImage frame = copy(canvas);
            if ("restoreToBackgroundColor".equals(disposal)) {
                Graphics2D clear = canvas.createGraphics();
                try {
                    clear.setColor(Color.BLACK);
                    clear.fillRect(x, y, raw.getWidth(), raw.getHeight());
                } finally {
                    clear.dispose();
                }
            }
            logger.debug("Decoded frame {}/{} of {}", index + 1, frameCount, path);
            return Optional.of(new RasterPixelGrid(frame));
        } catch (IOException | RuntimeException e) {
            // the GIF decoder reports some corrupt frames with unchecked exceptions
            throw new DecodeFailureException("Could not decode frame " + index, path, e);
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        reader.dispose();
        try {
            input.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close " + path, e);
        }
    }

    private static BufferedImage copy(BufferedImage src) {
        BufferedImage out = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static int[] logicalScreen(ImageReader reader) throws IOException {
        IIOMetadataNode root = nativeTree(reader.getStreamMetadata());
        return new int[]{
                intAttribute(root, "LogicalScreenDescriptor", "logicalScreenWidth"),
                intAttribute(root, "LogicalScreenDescriptor", "logicalScreenHeight")
        };
    }

    private static int delayOf(ImageReader reader, int index) throws IOException {
        IIOMetadataNode root = nativeTree(reader.getImageMetadata(index));
        // GIF delays are in hundredths of a second; 0 and 1 are treated as "unspecified" by browsers
        int delay = intAttribute(root, "GraphicControlExtension", "delayTime");
        return delay <= 1 ? DEFAULT_DELAY_MS : delay * 10;
    }

    private static IIOMetadataNode nativeTree(IIOMetadata meta) {
        if (meta == null) return null;
        return (IIOMetadataNode) meta.getAsTree(meta.getNativeMetadataFormatName());
    }

    private static String attribute(IIOMetadataNode root, String element, String name) {
        if (root == null) return null;
        NodeList nodes = root.getElementsByTagName(element);
        if (nodes.getLength() == 0) return null;
        String value = ((IIOMetadataNode) nodes.item(0)).getAttribute(name);
        return value == null || value.isEmpty() ? null : value;
    }

    private static int intAttribute(IIOMetadataNode root, String element, String name) {
        String value = attribute(root, element, name);
        if (value == null) return 0;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric GIF attribute {}.{}={}", element, name, value);
            return 0;
        }
    }

    private static void closeQuietly(ImageInputStream in, Exception primary) {
        if (in == null) return;
        try {
            in.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
