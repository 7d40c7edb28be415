package io.github.jakubt4.platesolver.controller;

import io.github.jakubt4.platesolver.dto.SolveResponse;
import io.github.jakubt4.platesolver.service.PlateSolveService;
import io.github.jakubt4.platesolver.service.solver.ScaleUnits;
import io.github.jakubt4.platesolver.service.solver.SolveOptions;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * REST endpoint for plate-solving an uploaded image.
 *
 * <p>Accepts {@code multipart/form-data} on {@code POST /solve} with an {@code image}
 * part and optional search fields. Optional fields that do not parse are ignored and
 * the default applies, so a sloppy client still gets a solve attempt.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Solving", description = "Plate-solving operations")
public class SolveController {

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".fits", ".fit");

    private static final Set<String> TRUE_VALUES = Set.of("1", "t", "T", "true", "TRUE", "True");
    private static final Set<String> FALSE_VALUES = Set.of("0", "f", "F", "false", "FALSE", "False");

    private final PlateSolveService plateSolveService;

    /**
     * Solves the uploaded image.
     *
     * @param image uploaded image (JPG, JPEG, PNG, FITS, FIT)
     * @param form  all form fields; {@code scale_low}, {@code scale_high}, {@code scale_units},
     *              {@code downsample_factor}, {@code depth_low}, {@code depth_high}, {@code ra},
     *              {@code dec}, {@code radius} and {@code keep_temp_files} are read
     * @return {@code 200 OK} once a solve was attempted (check {@code solved}), {@code 400 Bad Request}
     *         for a missing or unsupported image, {@code 500} if the upload cannot be staged
     */
    @Operation(summary = "Plate-solve an image",
            description = "Runs solve-field on the upload. Scale bounds from /analyse make solving much faster")
    @ApiResponse(responseCode = "200", description = "Solve attempted; check 'solved'")
    @ApiResponse(responseCode = "400", description = "Missing image or unsupported type")
    @PostMapping(value = "/solve", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SolveResponse> solve(@RequestParam(value = "image", required = false) final MultipartFile image,
                                               @RequestParam final Map<String, String> form) {
        if (image == null) {
            return ResponseEntity.badRequest().body(SolveResponse.error("Missing or invalid 'image' field"));
        }
        final var extension = UploadNames.extension(image.getOriginalFilename());
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            return ResponseEntity.badRequest()
                    .body(SolveResponse.error("Invalid file type. Supported: jpg, jpeg, png, fits, fit"));
        }

        final var options = parseOptions(form);
        log.info("Solving image: {} ({} KB)", image.getOriginalFilename(),
                String.format("%.2f", image.getSize() / 1024.0));
        try {
            final var result = plateSolveService.solve(image.getBytes(), extension, options);
            if (result.errorKind() != null) {
                log.warn("Solve failed [{}]: {}", result.errorKind(), result.errorMessage());
            }
            return ResponseEntity.ok(SolveResponse.from(result));
        } catch (final IOException | UncheckedIOException e) {
            log.error("Failed to save upload {}: {}", image.getOriginalFilename(), e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(SolveResponse.error("Failed to save file"));
        }
    }

    static SolveOptions parseOptions(final Map<String, String> form) {
        final var builder = SolveOptions.builder();
        parseDouble(form, "scale_low", builder::scaleLow);
        parseDouble(form, "scale_high", builder::scaleHigh);
        value(form, "scale_units").ifPresent(units -> ScaleUnits.fromFlagValue(units)
                .ifPresentOrElse(builder::scaleUnits, () -> log.debug("Ignoring unknown scale_units [{}]", units)));
        parsePositiveInt(form, "downsample_factor", builder::downsampleFactor);
        parsePositiveInt(form, "depth_low", builder::depthLow);
        parsePositiveInt(form, "depth_high", builder::depthHigh);
        parseDouble(form, "ra", builder::ra);
        parseDouble(form, "dec", builder::dec);
        parseDouble(form, "radius", builder::radius);
        value(form, "keep_temp_files").ifPresent(raw -> {
            if (TRUE_VALUES.contains(raw)) {
                builder.keepTempFiles(true);
            } else if (FALSE_VALUES.contains(raw)) {
                builder.keepTempFiles(false);
            } else {
                log.debug("Ignoring non-boolean keep_temp_files [{}]", raw);
            }
        });
        return builder.build();
    }

    private static void parseDouble(final Map<String, String> form, final String field, final Consumer<Double> target) {
        value(form, field).ifPresent(raw -> {
            try {
                final var parsed = Double.parseDouble(raw);
                if (Double.isFinite(parsed)) {
                    target.accept(parsed);
                }
            } catch (final NumberFormatException e) {
                log.debug("Ignoring non-numeric {} [{}]", field, raw);
            }
        });
    }

    private static void parsePositiveInt(final Map<String, String> form, final String field,
                                         final Consumer<Integer> target) {
        value(form, field).ifPresent(raw -> {
            try {
                final var parsed = Integer.parseInt(raw);
                if (parsed > 0) {
                    target.accept(parsed);
                }
            } catch (final NumberFormatException e) {
                log.debug("Ignoring non-integer {} [{}]", field, raw);
            }
        });
    }

    private static Optional<String> value(final Map<String, String> form, final String field) {
        final var raw = form.get(field);
        return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(raw.strip());
    }
}
