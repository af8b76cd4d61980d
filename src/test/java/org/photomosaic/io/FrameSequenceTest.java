package org.photomosaic.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.photomosaic.TestImages;
import org.photomosaic.error.DecodeFailureException;
import org.photomosaic.model.PixelGrid;
import org.photomosaic.model.RgbPixelGrid;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.metadata.IIOMetadata;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

import static org.junit.jupiter.api.Assertions.*;

class FrameSequenceTest {

    @Nested
    class Gif {

        @Test
        void readsEveryFrameInOrder(@TempDir Path dir) throws Exception {
            Path gif = TestImages.writeGif(dir.resolve("clip.gif"), 20,
                    TestImages.solid(6, 4, 0xFF0000),
                    TestImages.solid(6, 4, 0x00FF00),
                    TestImages.solid(6, 4, 0x0000FF));

            try (GifFrameSource source = GifFrameSource.open(gif)) {
                assertEquals(3, source.frameCount());
                assertEquals(6, source.width());
                assertEquals(4, source.height());
                assertEquals(5.0, source.frameRate(), 1e-9);

                assertEquals(0xFF0000, source.nextFrame().orElseThrow().getRgb(2, 2));
                assertEquals(0x00FF00, source.nextFrame().orElseThrow().getRgb(2, 2));
                assertEquals(0x0000FF, source.nextFrame().orElseThrow().getRgb(2, 2));
                assertTrue(source.nextFrame().isEmpty());
            }
        }

        @Test
        void framesAreIndependentCopies(@TempDir Path dir) throws Exception {
            Path gif = TestImages.writeGif(dir.resolve("clip.gif"), 10,
                    TestImages.solid(3, 3, 0xFFFFFF),
                    TestImages.solid(3, 3, 0x000000));

            try (GifFrameSource source = GifFrameSource.open(gif)) {
                PixelGrid first = source.nextFrame().orElseThrow();
                source.nextFrame();
                assertEquals(0xFFFFFF, first.getRgb(1, 1));
            }
        }

        @Test
        void unspecifiedDelay_defaultsToTenFps(@TempDir Path dir) throws Exception {
            Path gif = TestImages.writeGif(dir.resolve("clip.gif"), 0, TestImages.solid(2, 2, 0xFF0000));
            try (GifFrameSource source = GifFrameSource.open(gif)) {
                assertEquals(10.0, source.frameRate(), 1e-9);
            }
        }

        @Test
        void closed_refusesFrames(@TempDir Path dir) throws Exception {
            Path gif = TestImages.writeGif(dir.resolve("clip.gif"), 10, TestImages.solid(2, 2, 0xFF0000));
            GifFrameSource source = GifFrameSource.open(gif);
            source.close();
            source.close();
            assertThrows(IllegalStateException.class, source::nextFrame);
        }

        @Test
        void uncheckedDecoderFailure_becomesDecodeFailure(@TempDir Path dir) throws Exception {
            Path gif = TestImages.writeGif(dir.resolve("clip.gif"), 10,
                    TestImages.solid(2, 2, 0xFF0000),
                    TestImages.solid(2, 2, 0x00FF00));
            FailingGifReader reader = new FailingGifReader(1, false);

            try (GifFrameSource source = GifFrameSource.open(gif, reader)) {
                assertEquals(0xFF0000, source.nextFrame().orElseThrow().getRgb(0, 0));
                DecodeFailureException e = assertThrows(DecodeFailureException.class, source::nextFrame);
                assertEquals(gif, e.path().orElseThrow());
                assertInstanceOf(IllegalArgumentException.class, e.getCause());
            }
        }

        @Test
        void failedOpen_disposesReader(@TempDir Path dir) throws Exception {
            Path gif = TestImages.writeGif(dir.resolve("clip.gif"), 10, TestImages.solid(2, 2, 0xFF0000));
            FailingGifReader reader = new FailingGifReader(-1, true);

            assertThrows(DecodeFailureException.class, () -> GifFrameSource.open(gif, reader));
            assertTrue(reader.disposed);
        }

        @Test
        void uncheckedFailureWhileOpening_disposesReader(@TempDir Path dir) throws Exception {
            Path gif = TestImages.writeGif(dir.resolve("clip.gif"), 10, TestImages.solid(2, 2, 0xFF0000));
            FailingGifReader reader = new FailingGifReader(0, false);

            DecodeFailureException e = assertThrows(DecodeFailureException.class, () -> GifFrameSource.open(gif, reader));
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
            assertTrue(reader.disposed);
        }

        @Test
        void notAGif_throws(@TempDir Path dir) throws Exception {
            Path file = TestImages.writeGarbage(dir.resolve("clip.gif"));
            assertThrows(DecodeFailureException.class, () -> GifFrameSource.open(file));
        }
    }

    @Nested
    class PngSequence {

        @Test
        void writesNumberedFramesAndDescriptor(@TempDir Path dir) throws Exception {
            Path out = dir.resolve("frames");
            try (PngSequenceFrameSink sink = new PngSequenceFrameSink(out, 12.5, new ImageIoCodec())) {
                sink.append(RgbPixelGrid.filled(4, 2, 0x111111));
                sink.append(RgbPixelGrid.filled(4, 2, 0x222222));
                assertEquals(2, sink.frameCount());
            }

            assertTrue(Files.isRegularFile(out.resolve("frame-00000.png")));
            assertTrue(Files.isRegularFile(out.resolve("frame-00001.png")));

            JsonNode descriptor = new ObjectMapper().readTree(out.resolve(PngSequenceFrameSink.DESCRIPTOR).toFile());
            assertEquals(12.5, descriptor.get("frameRate").asDouble(), 1e-9);
            assertEquals(2, descriptor.get("frames").asInt());
            assertEquals(4, descriptor.get("width").asInt());
            assertEquals(2, descriptor.get("height").asInt());

            assertEquals(0x222222, new ImageIoCodec().decode(out.resolve("frame-00001.png")).getRgb(0, 0));
        }

        @Test
        void frameSizeChange_throws(@TempDir Path dir) {
            try (PngSequenceFrameSink sink = new PngSequenceFrameSink(dir, 10, new ImageIoCodec())) {
                sink.append(RgbPixelGrid.filled(4, 2, 0));
                assertThrows(IllegalArgumentException.class, () -> sink.append(RgbPixelGrid.filled(2, 2, 0)));
            }
        }

        @Test
        void invalidFrameRate_throws(@TempDir Path dir) {
            assertThrows(IllegalArgumentException.class, () -> new PngSequenceFrameSink(dir, 0, new ImageIoCodec()));
            assertThrows(IllegalArgumentException.class, () -> new PngSequenceFrameSink(dir, Double.NaN, new ImageIoCodec()));
        }

        @Test
        void frameName_isZeroPadded() {
            assertEquals("frame-00042.png", PngSequenceFrameSink.frameName(42));
        }
    }

    /**
     * Delegates to the JDK GIF reader but fails on a chosen frame the way a corrupt file can.
     */
    private static final class FailingGifReader extends ImageReader {

        private final ImageReader delegate = ImageIO.getImageReadersByFormatName("gif").next();
        private final int failingFrame;
        private final boolean failCount;
        boolean disposed;

        FailingGifReader(int failingFrame, boolean failCount) {
            super(null);
            this.failingFrame = failingFrame;
            this.failCount = failCount;
        }

        @Override
        public void setInput(Object input, boolean seekForwardOnly, boolean ignoreMetadata) {
            super.setInput(input, seekForwardOnly, ignoreMetadata);
            delegate.setInput(input, seekForwardOnly, ignoreMetadata);
        }

        @Override
        public int getNumImages(boolean allowSearch) throws IOException {
            if (failCount) {
                throw new IIOException("Truncated GIF");
            }
            return delegate.getNumImages(allowSearch);
        }

        @Override
        public int getWidth(int imageIndex) throws IOException {
            return delegate.getWidth(imageIndex);
        }

        @Override
        public int getHeight(int imageIndex) throws IOException {
            return delegate.getHeight(imageIndex);
        }

        @Override
        public Iterator<ImageTypeSpecifier> getImageTypes(int imageIndex) throws IOException {
            return delegate.getImageTypes(imageIndex);
        }

        @Override
        public IIOMetadata getStreamMetadata() throws IOException {
            return delegate.getStreamMetadata();
        }

        @Override
        public IIOMetadata getImageMetadata(int imageIndex) throws IOException {
            return delegate.getImageMetadata(imageIndex);
        }

        @Override
        public BufferedImage read(int imageIndex, ImageReadParam param) throws IOException {
            if (imageIndex == failingFrame) {
                throw new IllegalArgumentException("Bad LZW code in frame " + imageIndex);
            }
            return delegate.read(imageIndex, param);
        }

        @Override
        public void dispose() {
            disposed = true;
            delegate.dispose();
        }
    }
}
