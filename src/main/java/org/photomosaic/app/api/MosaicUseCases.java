package org.photomosaic.app.api;

import org.photomosaic.app.api.dto.MosaicReport;
import org.photomosaic.app.api.dto.MosaicRequest;
import org.photomosaic.dictionary.DictionaryResult;

import java.nio.file.Path;

/**
 * Application boundary consumed by the command line.
 * Keeps the entry point independent from the dictionary and compose packages.
 */
public interface MosaicUseCases {

    /**
     * Builds (or refreshes) the color cache of a tile source without compositing.
     */
    DictionaryResult buildDictionary(Path dictionary);

    /**
     * Builds the dictionary, composes the target and writes the result.
     */
    MosaicReport createMosaic(MosaicRequest request);
}
