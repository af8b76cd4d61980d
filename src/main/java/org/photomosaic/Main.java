package org.photomosaic;

import org.photomosaic.app.MosaicSettings;
import org.photomosaic.app.api.MosaicUseCases;
import org.photomosaic.app.api.dto.MosaicReport;
import org.photomosaic.app.api.dto.MosaicRequest;
import org.photomosaic.app.service.MosaicApplicationService;
import org.photomosaic.error.MosaicException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 * <pre>
 * photomosaic TARGET_IMAGE DICTIONARY [OUTPUT] [-w|--width N] [-h|--height N] [-p|--pixel-width N] [--video]
 * </pre>
 */
public final class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String USAGE = "Usage: photomosaic TARGET_IMAGE DICTIONARY [OUTPUT] "
            + "[-w|--width N] [-h|--height N] [-p|--pixel-width N] [--video]";

    static final int OK = 0;
    static final int FAILED = 1;
    static final int BAD_ARGUMENTS = 2;

    private Main() {}

    public static void main(String[] args) {
        MosaicSettings settings = MosaicSettings.load();
        System.exit(run(args, new MosaicApplicationService(settings), settings, System.err));
    }

    /**
     * Parses the arguments, runs the use case and maps the outcome to an exit code.
     */
    static int run(String[] args, MosaicUseCases useCases, MosaicSettings settings, PrintStream err) {
        MosaicRequest request;
        try {
            request = parse(args, settings);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return BAD_ARGUMENTS;
        }
        if (request == null) {
            err.println(USAGE);
            return OK;
        }

        try {
            MosaicReport report = useCases.createMosaic(request);
            if (!report.skipped().isEmpty()) {
                logger.warn("{} tiles could not be read and were skipped", report.skipped().size());
            }
            return OK;
        } catch (MosaicException e) {
            logger.error("{}{}", e.getMessage(), e.path().map(p -> " (" + p + ")").orElse(""), e);
            err.println(e.getMessage());
            return FAILED;
        }
    }

    /**
     * @return the request, or null when help was asked for
     * @throws IllegalArgumentException on missing or malformed arguments
     */
    static MosaicRequest parse(String[] args, MosaicSettings settings) {
        List<String> positional = new ArrayList<>();
        Integer width = null;
        Integer height = null;
        int pixels = settings.tilePixels();
        boolean video = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--help" -> {
                    return null;
                }
                case "-w", "--width" -> width = number(arg, args, ++i);
                case "-h", "--height" -> height = number(arg, args, ++i);
                case "-p", "-pw", "--pixel-width", "--pixel_width" -> pixels = number(arg, args, ++i);
                case "--video" -> video = true;
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    positional.add(arg);
                }
            }
        }

        if (positional.size() < 2) {
            throw new IllegalArgumentException("TARGET_IMAGE and DICTIONARY are required");
        }
        if (positional.size() > 3) {
            throw new IllegalArgumentException("Unexpected argument: " + positional.get(3));
        }
        Path output = Path.of(positional.size() == 3 ? positional.get(2) : settings.defaultOutput());
        return new MosaicRequest(Path.of(positional.get(0)), Path.of(positional.get(1)), output,
                width, height, pixels, video);
    }

    private static int number(String option, String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        try {
            int value = Integer.parseInt(args[index]);
            if (value <= 0) {
                throw new IllegalArgumentException("Invalid number for " + option + ": " + args[index]);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + args[index], e);
        }
    }
}
