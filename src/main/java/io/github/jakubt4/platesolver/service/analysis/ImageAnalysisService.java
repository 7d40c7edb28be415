package io.github.jakubt4.platesolver.service.analysis;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Works out a camera's field of view from EXIF so a solve can be given tight
 * scale bounds.
 *
 * <p>The imaged area is taken from the focal-plane resolution tags when the camera
 * records them, otherwise from the 35mm-equivalent focal length against a 36x24 mm
 * frame. No camera or sensor table is consulted.
 */
@Slf4j
@Service
public class ImageAnalysisService {

    public static final String FROM_FOCAL_PLANE = "focal_plane_resolution";
    public static final String FROM_35MM_EQUIVALENT = "35mm_equivalent";

    static final double FULL_FRAME_WIDTH_MM = 36.0;
    static final double FULL_FRAME_HEIGHT_MM = 24.0;

    /** Recommended bounds bracket the computed width by this fraction either side. */
    static final double SCALE_MARGIN = 0.2;

    /**
     * @throws ImageAnalysisException if the stream is not a recognised image or carries no EXIF block
     * @throws IOException            if the stream cannot be read
     */
    public ImageAnalysis analyse(final InputStream image) throws IOException {
        final Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(image);
        } catch (final ImageProcessingException e) {
            throw new ImageAnalysisException("unrecognised image: " + e.getMessage(), e);
        }

        final var ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        final var exif = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        if (ifd0 == null && exif == null) {
            throw new ImageAnalysisException("no EXIF data found");
        }

        final var make = text(ifd0, ExifDirectoryBase.TAG_MAKE);
        final var model = text(ifd0, ExifDirectoryBase.TAG_MODEL);
        final var focalLength = positive(exif, ExifDirectoryBase.TAG_FOCAL_LENGTH);
        final var equivalentFocalLength = positive(exif, ExifDirectoryBase.TAG_35MM_FILM_EQUIV_FOCAL_LENGTH);
        final var reportedFocalLength = focalLength != null ? focalLength : equivalentFocalLength;

        final var optics = fromFocalPlane(exif, focalLength)
                .or(() -> fromEquivalentFocalLength(exif, equivalentFocalLength));
        if (optics.isEmpty()) {
            log.info("EXIF of {} {} has no usable focal length, field of view unknown", make, model);
            return new ImageAnalysis(make, model, reportedFocalLength, true, null, null, null, null);
        }

        final var geometry = optics.get();
        final var fov = FieldOfView.of(geometry.widthMm(), geometry.heightMm(), geometry.focalLengthMm());
        log.info("Field of view {} x {} deg from {} ({} {}, {} mm)",
                String.format("%.2f", fov.widthDegrees()), String.format("%.2f", fov.heightDegrees()),
                geometry.source(), make, model, reportedFocalLength);
        return new ImageAnalysis(make, model, reportedFocalLength, true, geometry.source(), fov,
                fov.widthArcmin() * (1 - SCALE_MARGIN), fov.widthArcmin() * (1 + SCALE_MARGIN));
    }

    private static Optional<Optics> fromFocalPlane(final Directory exif, final Double focalLength) {
        final var pixelWidth = positiveInt(exif, ExifDirectoryBase.TAG_EXIF_IMAGE_WIDTH);
        final var pixelHeight = positiveInt(exif, ExifDirectoryBase.TAG_EXIF_IMAGE_HEIGHT);
        final var xResolution = positive(exif, ExifDirectoryBase.TAG_FOCAL_PLANE_X_RESOLUTION);
        if (focalLength == null || pixelWidth == null || pixelHeight == null || xResolution == null) {
            return Optional.empty();
        }
        final var yResolution = Optional.ofNullable(positive(exif, ExifDirectoryBase.TAG_FOCAL_PLANE_Y_RESOLUTION))
                .orElse(xResolution);
        return millimetresPerUnit(exif.getInteger(ExifDirectoryBase.TAG_FOCAL_PLANE_RESOLUTION_UNIT))
                .map(mm -> new Optics(pixelWidth / xResolution * mm, pixelHeight / yResolution * mm,
                        focalLength, FROM_FOCAL_PLANE));
    }

    private static Optional<Optics> fromEquivalentFocalLength(final Directory exif, final Double equivalent) {
        if (equivalent == null) {
            return Optional.empty();
        }
        final var pixelWidth = positiveInt(exif, ExifDirectoryBase.TAG_EXIF_IMAGE_WIDTH);
        final var pixelHeight = positiveInt(exif, ExifDirectoryBase.TAG_EXIF_IMAGE_HEIGHT);
        final var portrait = pixelWidth != null && pixelHeight != null && pixelHeight > pixelWidth;
        return Optional.of(portrait
                ? new Optics(FULL_FRAME_HEIGHT_MM, FULL_FRAME_WIDTH_MM, equivalent, FROM_35MM_EQUIVALENT)
                : new Optics(FULL_FRAME_WIDTH_MM, FULL_FRAME_HEIGHT_MM, equivalent, FROM_35MM_EQUIVALENT));
    }

    // EXIF FocalPlaneResolutionUnit: 2 inch (default), 3 cm, 4 mm, 5 micrometre
    private static Optional<Double> millimetresPerUnit(final Integer unit) {
        if (unit == null || unit == 2) {
            return Optional.of(25.4);
        }
        if (unit == 3) {
            return Optional.of(10.0);
        }
        if (unit == 4) {
            return Optional.of(1.0);
        }
        if (unit == 5) {
            return Optional.of(0.001);
        }
        return Optional.empty();
    }

    private static String text(final Directory directory, final int tag) {
        if (directory == null) {
            return null;
        }
        final var value = directory.getString(tag);
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static Double positive(final Directory directory, final int tag) {
        if (directory == null) {
            return null;
        }
        final var value = directory.getDoubleObject(tag);
        return value != null && Double.isFinite(value) && value > 0 ? value : null;
    }

    private static Integer positiveInt(final Directory directory, final int tag) {
        if (directory == null) {
            return null;
        }
        final var value = directory.getInteger(tag);
        return value != null && value > 0 ? value : null;
    }

    private record Optics(double widthMm, double heightMm, double focalLengthMm, String source) {
    }
}
