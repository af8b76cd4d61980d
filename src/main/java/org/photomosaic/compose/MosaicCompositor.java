package org.photomosaic.compose;

import org.photomosaic.concurrent.WorkerPool;
import org.photomosaic.io.FrameSink;
import org.photomosaic.io.FrameSource;
import org.photomosaic.metrics.ColorIndex;
import org.photomosaic.model.PixelGrid;
import org.photomosaic.model.RgbPixelGrid;
import org.photomosaic.model.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Replaces every pixel of a target image with the closest tile of a {@link ColorIndex}.
 * <p>
 * The canvas is {@code targetWidth * tileWidth} by {@code targetHeight * tileHeight}. Target rows
 * are split into bands; each band owns the canvas rows its tiles land on and nothing else, so
 * workers write into the shared canvas without coordination. The canvas is only returned once
 * every band has finished.
 */
public final class MosaicCompositor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MosaicCompositor.class);

    private final WorkerPool pool;

    /**
     * @param workers number of worker threads, 0 or less for the available parallelism
     */
    public MosaicCompositor(int workers) {
        this.pool = new WorkerPool("compose", workers);
    }

    public MosaicCompositor() {
        this(0);
    }

    /**
     * Builds the mosaic of one target image.
     *
     * @param index  finalized index with tile pixels (non-null)
     * @param target image to reproduce, only read (non-null)
     * @return a new canvas; 0x0 for an empty target
     * @throws IllegalArgumentException if the index was built without tile pixels
     */
    public RgbPixelGrid compose(ColorIndex index, PixelGrid target) {
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(target, "target must not be null");
        if (!index.hasPixels()) {
            throw new IllegalArgumentException("Color index has no tile pixels; build it with a tile size");
        }

        int tw = index.tileWidth();
        int th = index.tileHeight();
        RgbPixelGrid canvas = new RgbPixelGrid(
                Math.multiplyExact(target.width(), tw),
                Math.multiplyExact(target.height(), th));
        if (target.pixelCount() == 0) {
            return canvas;
        }

        List<CanvasBand> bands = partition(canvas, target.height(), th, pool.threads());
        List<Runnable> work = new ArrayList<>(bands.size());
        for (CanvasBand band : bands) {
            work.add(() -> drawBand(index, target, band));
        }
        pool.runAll(work);

        logger.debug("Composed {}x{} target into {}x{} canvas using {} bands",
                target.width(), target.height(), canvas.width(), canvas.height(), bands.size());
        return canvas;
    }

    /**
     * Composes every frame of a source into a sink against the same index.
     *
     * @param prepare applied to each frame before composition (e.g. resizing)
     * @return number of frames written
     */
    public int composeFrames(ColorIndex index, FrameSource source, FrameSink sink, UnaryOperator<PixelGrid> prepare) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(prepare, "prepare must not be null");

        int frames = 0;
        Optional<PixelGrid> frame;
        while ((frame = source.nextFrame()).isPresent()) {
            sink.append(compose(index, prepare.apply(frame.get())));
            frames++;
            if (frames % 10 == 0) {
                logger.info("Processed {} frames", frames);
            }
        }
        logger.info("Processed {} frames in total", frames);
        return frames;
    }

    /**
     * Cuts the target rows into at most {@code bandCount} contiguous bands and gives each band
     * the matching horizontal strip of the canvas. Strips never overlap.
     */
    static List<CanvasBand> partition(PixelGrid canvas, int targetRows, int tileHeight, int bandCount) {
        int count = Math.max(1, Math.min(bandCount, targetRows));
        int rowsPerBand = (targetRows + count - 1) / count;

        List<CanvasBand> bands = new ArrayList<>(count);
        for (int first = 0; first < targetRows; first += rowsPerBand) {
            int end = Math.min(targetRows, first + rowsPerBand);
            PixelGrid strip = canvas.region(0, first * tileHeight, canvas.width(), (end - first) * tileHeight);
            bands.add(new CanvasBand(first, end, strip));
        }
        return bands;
    }

    private static void drawBand(ColorIndex index, PixelGrid target, CanvasBand band) {
        int tw = index.tileWidth();
        int th = index.tileHeight();
        PixelGrid region = band.region();
        for (int y = band.firstRow(); y < band.endRow(); y++) {
            int dy = (y - band.firstRow()) * th;
            for (int x = 0; x < target.width(); x++) {
                Tile tile = index.closestToPixel(target.getRgb(x, y));
                region.paste(tile.requirePixels(), x * tw, dy);
            }
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
