package org.photomosaic.app.service;

import org.photomosaic.app.MosaicSettings;
import org.photomosaic.app.TargetDimensions;
import org.photomosaic.app.api.MosaicUseCases;
import org.photomosaic.app.api.dto.MosaicReport;
import org.photomosaic.app.api.dto.MosaicRequest;
import org.photomosaic.compose.MosaicCompositor;
import org.photomosaic.dictionary.DictionaryBuilder;
import org.photomosaic.dictionary.DictionaryResult;
import org.photomosaic.io.GifFrameSource;
import org.photomosaic.io.ImageCodec;
import org.photomosaic.io.ImageIoCodec;
import org.photomosaic.io.PngSequenceFrameSink;
import org.photomosaic.io.TileCache;
import org.photomosaic.io.json.CacheFileFormat;
import org.photomosaic.io.json.JsonTileCache;
import org.photomosaic.metrics.ColorIndex;
import org.photomosaic.metrics.SquaredEuclideanDistance;
import org.photomosaic.model.PixelGrid;
import org.photomosaic.model.PixelGrids;
import org.photomosaic.model.RgbPixelGrid;
import org.photomosaic.model.TileSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/** Default application service used by the command line through MosaicUseCases. */
public final class MosaicApplicationService implements MosaicUseCases {

    private static final Logger logger = LoggerFactory.getLogger(MosaicApplicationService.class);

    private final MosaicSettings settings;
    private final ImageCodec codec;
    private final TileCache cache;

    public MosaicApplicationService(MosaicSettings settings, ImageCodec codec, TileCache cache) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    public MosaicApplicationService(MosaicSettings settings) {
        this(settings, new ImageIoCodec(), new JsonTileCache(CacheFileFormat.named(settings.cacheFile())));
    }

    public MosaicApplicationService() {
        this(MosaicSettings.load());
    }

    @Override
    public DictionaryResult buildDictionary(Path dictionary) {
        Objects.requireNonNull(dictionary, "dictionary must not be null");
        return builder(null).build(dictionary);
    }

    @Override
    public MosaicReport createMosaic(MosaicRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return request.video() ? createVideoMosaic(request) : createImageMosaic(request);
    }

    private MosaicReport createImageMosaic(MosaicRequest request) {
        PixelGrid target = codec.decode(request.target());
        logger.info("Loaded target {} ({}x{})", request.target(), target.width(), target.height());

        DictionaryResult dictionary = builder(TileSize.square(request.tilePixels())).build(request.dictionary());
        ColorIndex index = dictionary.index();

        PixelGrid prepared = prepare(target, request);
        logger.info("Processing {}x{} target with {} tiles", prepared.width(), prepared.height(), index.size());

        RgbPixelGrid canvas;
        try (MosaicCompositor compositor = new MosaicCompositor(settings.workers())) {
            canvas = compositor.compose(index, prepared);
        }
        logger.info("Final image size: {}x{}", canvas.width(), canvas.height());

        codec.encode(canvas, request.output());
        logger.info("Saved mosaic to {}", request.output());
        return new MosaicReport(request.output(), index.size(), canvas.width(), canvas.height(), 1,
                dictionary.stats(), dictionary.failures());
    }

    private MosaicReport createVideoMosaic(MosaicRequest request) {
        try (GifFrameSource source = GifFrameSource.open(request.target())) {
            logger.info("Opened video {} ({}x{}, {} fps)", request.target(), source.width(), source.height(),
                    String.format("%.2f", source.frameRate()));

            DictionaryResult dictionary = builder(TileSize.square(request.tilePixels())).build(request.dictionary());
            ColorIndex index = dictionary.index();

            TargetDimensions dims = TargetDimensions.resolve(request.width(), request.height(), source.width(), source.height());
            int frames;
            try (MosaicCompositor compositor = new MosaicCompositor(settings.workers());
                 PngSequenceFrameSink sink = new PngSequenceFrameSink(request.output(), source.frameRate(), codec)) {
                frames = compositor.composeFrames(index, source, sink, frame -> resizeIfNeeded(frame, dims));
            }
            return new MosaicReport(request.output(), index.size(),
                    dims.width() * index.tileWidth(), dims.height() * index.tileHeight(), frames,
                    dictionary.stats(), dictionary.failures());
        }
    }

    private DictionaryBuilder builder(TileSize tileSize) {
        return new DictionaryBuilder(codec, cache, tileSize, settings.comparisonSpace(),
                new SquaredEuclideanDistance(), settings.workers());
    }

    private static PixelGrid prepare(PixelGrid target, MosaicRequest request) {
        TargetDimensions dims = TargetDimensions.resolve(request.width(), request.height(), target.width(), target.height());
        return resizeIfNeeded(target, dims);
    }

    private static PixelGrid resizeIfNeeded(PixelGrid grid, TargetDimensions dims) {
        if (dims.matches(grid.width(), grid.height()) || grid.pixelCount() == 0) {
            return grid;
        }
        return PixelGrids.resize(grid, dims.width(), dims.height());
    }
}
