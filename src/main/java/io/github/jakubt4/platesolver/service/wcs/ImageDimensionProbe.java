package io.github.jakubt4.platesolver.service.wcs;

import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Reads pixel dimensions from an image file without decoding its pixels.
 *
 * <p>FITS files are read through nom-tam-fits ({@code NAXIS1}/{@code NAXIS2} of the
 * primary HDU); everything else goes through the installed ImageIO readers. Any
 * failure of either reader, checked or not, yields an empty result.
 */
@Slf4j
@Component
public class ImageDimensionProbe {

    private static final Set<String> FITS_EXTENSIONS = Set.of("fits", "fit", "fts");

    public Optional<ImageDimensions> probe(final Path image) {
        if (image == null) {
            return Optional.empty();
        }
        final var fits = isFits(image);
        try {
            return fits ? fitsDimensions(image) : rasterDimensions(image);
        } catch (final IOException | RuntimeException e) {
            log.warn("Cannot read {} dimensions of {}: {}", fits ? "FITS" : "image",
                    image.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    Optional<ImageDimensions> fitsDimensions(final Path image) throws FitsException, IOException {
        try (Fits fits = new Fits(image.toFile())) {
            final BasicHDU<?> hdu = fits.readHDU();
            if (hdu == null) {
                return Optional.empty();
            }
            final var header = hdu.getHeader();
            return dimensions(header.getIntValue("NAXIS1", 0), header.getIntValue("NAXIS2", 0));
        }
    }

    Optional<ImageDimensions> rasterDimensions(final Path image) throws IOException {
        try (var input = ImageIO.createImageInputStream(image.toFile())) {
            if (input == null) {
                return Optional.empty();
            }
            final var readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return Optional.empty();
            }
            final var reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return dimensions(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        }
    }

    private static Optional<ImageDimensions> dimensions(final int width, final int height) {
        return width > 0 && height > 0 ? Optional.of(new ImageDimensions(width, height)) : Optional.empty();
    }

    private static boolean isFits(final Path image) {
        final var name = image.getFileName().toString();
        final var dot = name.lastIndexOf('.');
        return dot >= 0 && FITS_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
