package org.photomosaic;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.photomosaic.app.MosaicSettings;
import org.photomosaic.app.api.MosaicUseCases;
import org.photomosaic.app.api.dto.MosaicReport;
import org.photomosaic.app.api.dto.MosaicRequest;
import org.photomosaic.dictionary.DictionaryResult;
import org.photomosaic.dictionary.DictionaryStats;
import org.photomosaic.error.EmptyDictionaryException;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final MosaicSettings settings = MosaicSettings.defaults();

    @Nested
    class Parse {

        @Test
        void positionalOnly_usesDefaults() {
            MosaicRequest request = Main.parse(new String[]{"in.png", "tiles"}, settings);

            assertEquals(Path.of("in.png"), request.target());
            assertEquals(Path.of("tiles"), request.dictionary());
            assertEquals(Path.of("output.png"), request.output());
            assertNull(request.width());
            assertNull(request.height());
            assertEquals(32, request.tilePixels());
            assertFalse(request.video());
        }

        @Test
        void allOptions() {
            MosaicRequest request = Main.parse(new String[]{
                    "-w", "40", "in.gif", "--height", "30", "tiles", "out", "--pixel-width", "16", "--video"}, settings);

            assertEquals(Path.of("out"), request.output());
            assertEquals(40, request.width());
            assertEquals(30, request.height());
            assertEquals(16, request.tilePixels());
            assertTrue(request.video());
        }

        @Test
        void pixelWidthAliases() {
            for (String alias : List.of("-p", "-pw", "--pixel-width", "--pixel_width")) {
                assertEquals(8, Main.parse(new String[]{"a", "b", alias, "8"}, settings).tilePixels());
            }
        }

        @Test
        void help_returnsNull() {
            assertNull(Main.parse(new String[]{"--help"}, settings));
        }

        @Test
        void invalidArguments_throw() {
            assertThrows(IllegalArgumentException.class, () -> Main.parse(new String[]{"only-one"}, settings));
            assertThrows(IllegalArgumentException.class, () -> Main.parse(new String[]{"a", "b", "c", "d"}, settings));
            assertThrows(IllegalArgumentException.class, () -> Main.parse(new String[]{"a", "b", "--bogus"}, settings));
            assertThrows(IllegalArgumentException.class, () -> Main.parse(new String[]{"a", "b", "-w"}, settings));
            assertThrows(IllegalArgumentException.class, () -> Main.parse(new String[]{"a", "b", "-w", "x"}, settings));
            assertThrows(IllegalArgumentException.class, () -> Main.parse(new String[]{"a", "b", "-p", "0"}, settings));
        }
    }

    @Nested
    class Run {

        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        private final PrintStream err = new PrintStream(bytes, true, StandardCharsets.UTF_8);

        private String errText() {
            return bytes.toString(StandardCharsets.UTF_8);
        }

        @Test
        void success_exitsZero() {
            RecordingUseCases useCases = new RecordingUseCases(null);

            assertEquals(Main.OK, Main.run(new String[]{"in.png", "tiles", "-w", "5"}, useCases, settings, err));
            assertEquals(5, useCases.last.width());
        }

        @Test
        void badArguments_printUsage() {
            RecordingUseCases useCases = new RecordingUseCases(null);

            assertEquals(Main.BAD_ARGUMENTS, Main.run(new String[]{"in.png"}, useCases, settings, err));
            assertTrue(errText().contains(Main.USAGE));
            assertNull(useCases.last);
        }

        @Test
        void help_printsUsage() {
            assertEquals(Main.OK, Main.run(new String[]{"--help"}, new RecordingUseCases(null), settings, err));
            assertTrue(errText().contains("photomosaic"));
        }

        @Test
        void pipelineFailure_exitsOne() {
            RecordingUseCases useCases = new RecordingUseCases(new EmptyDictionaryException(Path.of("tiles")));

            assertEquals(Main.FAILED, Main.run(new String[]{"in.png", "tiles"}, useCases, settings, err));
            assertTrue(errText().contains("no usable tiles"));
        }
    }

    private static final class RecordingUseCases implements MosaicUseCases {

        private final RuntimeException failure;
        private MosaicRequest last;

        RecordingUseCases(RuntimeException failure) {
            this.failure = failure;
        }

        @Override
        public DictionaryResult buildDictionary(Path dictionary) {
            throw new UnsupportedOperationException();
        }

        @Override
        public MosaicReport createMosaic(MosaicRequest request) {
            last = request;
            if (failure != null) throw failure;
            return new MosaicReport(request.output(), 1, 1, 1, 1, new DictionaryStats(0, 0, 0, 0, 0), List.of());
        }
    }
}
