package org.photomosaic.app.api.dto;

import org.photomosaic.dictionary.DictionaryStats;
import org.photomosaic.dictionary.TileFailure;

import java.nio.file.Path;
import java.util.List;

/** What a finished run produced. */
public record MosaicReport(Path output, int tiles, int canvasWidth, int canvasHeight, int frames,
                           DictionaryStats stats, List<TileFailure> skipped) {

    public MosaicReport {
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }
}
