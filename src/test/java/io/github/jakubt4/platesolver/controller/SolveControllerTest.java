package io.github.jakubt4.platesolver.controller;

import io.github.jakubt4.platesolver.service.PlateSolveService;
import io.github.jakubt4.platesolver.service.solver.ScaleUnits;
import io.github.jakubt4.platesolver.service.solver.SolveErrorKind;
import io.github.jakubt4.platesolver.service.solver.SolveOptions;
import io.github.jakubt4.platesolver.service.solver.SolveResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SolveController.class)
class SolveControllerTest {

    private static final MockMultipartFile JPEG =
            new MockMultipartFile("image", "orion.JPG", "image/jpeg", new byte[]{1, 2, 3});

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PlateSolveService plateSolveService;

    @Test
    void solvedImageReturnsCoordinatesInSnakeCase() throws Exception {
        final var header = new LinkedHashMap<String, String>();
        header.put("CRVAL1", "83.421");
        header.put("CTYPE1", "RA---TAN-SIP");
        when(plateSolveService.solve(any(), anyString(), any())).thenReturn(new SolveResult(
                true, 83.421, -5.891, 3.96, 22.43, 2.25, 1.5, header, 5.5, "Field 1: solved", null, null));

        mockMvc.perform(multipart("/solve").file(JPEG))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.solved").value(true))
                .andExpect(jsonPath("$.ra").value(83.421))
                .andExpect(jsonPath("$.dec").value(-5.891))
                .andExpect(jsonPath("$.pixel_scale").value(3.96))
                .andExpect(jsonPath("$.rotation").value(22.43))
                .andExpect(jsonPath("$.field_width").value(2.25))
                .andExpect(jsonPath("$.field_height").value(1.5))
                .andExpect(jsonPath("$.wcs_header.CTYPE1").value("RA---TAN-SIP"))
                .andExpect(jsonPath("$.solve_time").value(5.5))
                .andExpect(jsonPath("$.raw_output").value("Field 1: solved"))
                .andExpect(jsonPath("$.error").doesNotExist())
                .andExpect(jsonPath("$.error_kind").doesNotExist());

        verify(plateSolveService).solve(any(), eq(".jpg"), eq(SolveOptions.defaults()));
    }

    @Test
    void unsolvedImageIsStillOkWithSolverLog() throws Exception {
        when(plateSolveService.solve(any(), anyString(), any()))
                .thenReturn(SolveResult.unsolved(7.5, "Did not solve"));

        mockMvc.perform(multipart("/solve").file(JPEG))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.solved").value(false))
                .andExpect(jsonPath("$.solve_time").value(7.5))
                .andExpect(jsonPath("$.raw_output").value("Did not solve"))
                .andExpect(jsonPath("$.ra").doesNotExist())
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void classifiedFailureIsReportedInTheBody() throws Exception {
        when(plateSolveService.solve(any(), anyString(), any())).thenReturn(SolveResult.failed(
                SolveErrorKind.TIMEOUT, "solve-field did not finish within 300000 ms", 300.0, "searching..."));

        mockMvc.perform(multipart("/solve").file(JPEG))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.solved").value(false))
                .andExpect(jsonPath("$.error_kind").value("TIMEOUT"))
                .andExpect(jsonPath("$.error").value("solve-field did not finish within 300000 ms"))
                .andExpect(jsonPath("$.raw_output").value("searching..."));
    }

    @Test
    void formFieldsBecomeSolveOptions() throws Exception {
        when(plateSolveService.solve(any(), anyString(), any())).thenReturn(SolveResult.unsolved(1.0, ""));

        mockMvc.perform(multipart("/solve").file(JPEG)
                        .param("scale_low", "30")
                        .param("scale_high", "90")
                        .param("scale_units", "degwidth")
                        .param("downsample_factor", "4")
                        .param("depth_low", "5")
                        .param("depth_high", "50")
                        .param("ra", "83.82")
                        .param("dec", "-5.39")
                        .param("radius", "2")
                        .param("keep_temp_files", "true"))
                .andExpect(status().isOk());

        final var captor = ArgumentCaptor.forClass(SolveOptions.class);
        verify(plateSolveService).solve(any(), eq(".jpg"), captor.capture());
        assertThat(captor.getValue()).isEqualTo(new SolveOptions(
                30.0, 90.0, ScaleUnits.DEGREES_WIDTH, 4, 5, 50, 83.82, -5.39, 2.0, true));
    }

    @Test
    void unparseableFormFieldsFallBackToDefaults() {
        final var options = SolveController.parseOptions(Map.of(
                "scale_low", "wide",
                "scale_units", "furlongs",
                "downsample_factor", "0",
                "depth_low", "1.5",
                "ra", "NaN",
                "keep_temp_files", "maybe"));

        assertThat(options).isEqualTo(SolveOptions.defaults());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "t", "T", "true", "TRUE", "True"})
    void keepTempFilesAcceptsTrueSpellings(final String raw) {
        assertThat(SolveController.parseOptions(Map.of("keep_temp_files", raw)).keepTempFiles()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "f", "F", "false", "FALSE", "False"})
    void keepTempFilesAcceptsFalseSpellings(final String raw) {
        final var options = SolveController.parseOptions(Map.of("keep_temp_files", raw, "downsample_factor", "3"));
        assertThat(options).isEqualTo(SolveOptions.builder().downsampleFactor(3).keepTempFiles(false).build());
    }

    @ParameterizedTest
    @ValueSource(strings = {"yes", "tRuE", "on", "2"})
    void keepTempFilesIgnoresOtherSpellings(final String raw) {
        assertThat(SolveController.parseOptions(Map.of("keep_temp_files", raw))).isEqualTo(SolveOptions.defaults());
    }

    @Test
    void emptyUploadIsHandedToTheSolver() throws Exception {
        final var empty = new MockMultipartFile("image", "blank.png", "image/png", new byte[0]);
        when(plateSolveService.solve(any(), anyString(), any()))
                .thenReturn(SolveResult.unsolved(0.2, "ERROR: failed to read image"));

        mockMvc.perform(multipart("/solve").file(empty))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.solved").value(false))
                .andExpect(jsonPath("$.raw_output").value("ERROR: failed to read image"));

        verify(plateSolveService).solve(eq(new byte[0]), eq(".png"), eq(SolveOptions.defaults()));
    }

    @Test
    void unsupportedExtensionIsRejectedBeforeSolving() throws Exception {
        final var gif = new MockMultipartFile("image", "orion.gif", "image/gif", new byte[]{1});

        mockMvc.perform(multipart("/solve").file(gif))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.solved").value(false))
                .andExpect(jsonPath("$.error").value("Invalid file type. Supported: jpg, jpeg, png, fits, fit"));

        verifyNoInteractions(plateSolveService);
    }

    @Test
    void missingImageIsRejected() throws Exception {
        mockMvc.perform(multipart("/solve").param("ra", "10"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing or invalid 'image' field"));

        verifyNoInteractions(plateSolveService);
    }

    @Test
    void stagingFailureIsAServerError() throws Exception {
        when(plateSolveService.solve(any(), anyString(), any()))
                .thenThrow(new UncheckedIOException(new IOException("No space left on device")));

        mockMvc.perform(multipart("/solve").file(JPEG))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.solved").value(false))
                .andExpect(jsonPath("$.error").value("Failed to save file"));
    }
}
