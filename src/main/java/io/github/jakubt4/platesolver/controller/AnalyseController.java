package io.github.jakubt4.platesolver.controller;

import io.github.jakubt4.platesolver.dto.AnalyseResponse;
import io.github.jakubt4.platesolver.service.analysis.ImageAnalysisException;
import io.github.jakubt4.platesolver.service.analysis.ImageAnalysisService;
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
import java.util.Set;

/**
 * Reads camera EXIF from an upload and recommends scale bounds for a later solve.
 * No plate solving happens here.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Analysis", description = "Image analysis and FOV calculation")
public class AnalyseController {

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png");

    private final ImageAnalysisService imageAnalysisService;

    @Operation(summary = "Analyse image EXIF and calculate FOV",
            description = "Returns the camera's field of view and scale_low/scale_high in arcminwidth "
                    + "for use with /solve")
    @ApiResponse(responseCode = "200", description = "Analysis complete")
    @ApiResponse(responseCode = "400", description = "Missing image, unsupported type or no EXIF")
    @PostMapping(value = "/analyse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AnalyseResponse> analyse(
            @RequestParam(value = "image", required = false) final MultipartFile image) {
        if (image == null) {
            return ResponseEntity.badRequest().body(AnalyseResponse.error("Missing or invalid 'image' field"));
        }
        if (!SUPPORTED_EXTENSIONS.contains(UploadNames.extension(image.getOriginalFilename()))) {
            return ResponseEntity.badRequest()
                    .body(AnalyseResponse.error("Invalid file type. Supported: jpg, jpeg, png"));
        }

        log.info("Analysing image: {} ({} KB)", image.getOriginalFilename(),
                String.format("%.2f", image.getSize() / 1024.0));
        try (var input = image.getInputStream()) {
            return ResponseEntity.ok(AnalyseResponse.from(imageAnalysisService.analyse(input)));
        } catch (final ImageAnalysisException e) {
            log.warn("Analysis of {} failed: {}", image.getOriginalFilename(), e.getMessage());
            return ResponseEntity.badRequest().body(AnalyseResponse.error("Failed to analyse image: " + e.getMessage()));
        } catch (final IOException e) {
            log.error("Failed to read upload {}: {}", image.getOriginalFilename(), e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(AnalyseResponse.error("Failed to read file"));
        }
    }
}
