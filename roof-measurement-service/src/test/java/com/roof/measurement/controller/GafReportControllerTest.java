package com.roof.measurement.controller;

import com.roof.measurement.dto.CalibrationSummary;
import com.roof.measurement.dto.GafCalibrationResult;
import com.roof.measurement.dto.GafComparison;
import com.roof.measurement.dto.GafReport;
import com.roof.measurement.dto.GafReportRequest;
import com.roof.measurement.exception.MeasurementProcessingException;
import com.roof.measurement.exception.ReportNotFoundException;
import com.roof.measurement.service.GafReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for the GAF report and calibration controllers.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("GAF Report Controller Tests")
class GafReportControllerTest {

    private static final String REPORT_ID = "0b6f4c1e-report";

    @Mock
    private GafReportService gafReportService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
            .standaloneSetup(new GafReportController(gafReportService), new CalibrationController(gafReportService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    private static GafReport storedReport() {
        return GafReport.builder()
            .reportId(REPORT_ID)
            .userId("user-1")
            .address("123 Main St")
            .latitude(39.7392)
            .longitude(-104.9903)
            .regionCode("39.7,-105.0")
            .totalSquares(21.0)
            .totalAreaSqFt(2100.0)
            .reportDate(LocalDate.of(2024, 5, 30))
            .build();
    }

    @Test
    void should_ReturnCreated_When_ReportStored() throws Exception {
        when(gafReportService.createReport(any(GafReportRequest.class))).thenReturn(storedReport());

        mockMvc.perform(post("/api/gaf-reports")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"user-1\",\"address\":\"123 Main St\",\"lat\":39.7392,\"lng\":-104.9903,"
                    + "\"totalSquares\":21.0,\"pitchInfo\":\"6/12\",\"reportDate\":\"2024-05-30\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.reportId", is(REPORT_ID)))
            .andExpect(jsonPath("$.totalAreaSqFt", closeTo(2100.0, 1e-9)));

        verify(gafReportService).createReport(new GafReportRequest("user-1", "123 Main St", 39.7392, -104.9903,
            21.0, "6/12", null, null, LocalDate.of(2024, 5, 30), null, null));
    }

    @Test
    void should_ReturnBadRequest_When_ReportInvalid() throws Exception {
        when(gafReportService.createReport(any(GafReportRequest.class)))
            .thenThrow(new IllegalArgumentException("Invalid GAF report: Address is required"));

        mockMvc.perform(post("/api/gaf-reports")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"user-1\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", is("Invalid GAF report: Address is required")));
    }

    @Test
    void should_ReturnServerError_When_StoreFails() throws Exception {
        when(gafReportService.createReport(any(GafReportRequest.class)))
            .thenThrow(new MeasurementProcessingException("Failed to store GAF report", new IllegalStateException()));

        mockMvc.perform(post("/api/gaf-reports")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"user-1\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error", is("Measurement Processing Error")));
    }

    @Test
    void should_ReturnNotFound_When_ReportUnknown() throws Exception {
        when(gafReportService.getReport("missing")).thenThrow(new ReportNotFoundException("missing"));

        mockMvc.perform(get("/api/gaf-reports/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message", is("GAF report not found: missing")));
    }

    @Test
    void should_ListReportsForUser() throws Exception {
        when(gafReportService.getReportsForUser("user-1")).thenReturn(List.of(storedReport()));

        mockMvc.perform(get("/api/gaf-reports").param("userId", "user-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].reportId", is(REPORT_ID)));
    }

    @Test
    void should_CompareCalculatedArea() throws Exception {
        when(gafReportService.compare(REPORT_ID, 2000.0))
            .thenReturn(new GafComparison(REPORT_ID, 2000.0, 2100.0, -100.0, -4.76, null));

        mockMvc.perform(get("/api/gaf-reports/{id}/comparison", REPORT_ID).param("calculatedArea", "2000"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.differenceSqFt", closeTo(-100.0, 1e-9)));
    }

    @Test
    void should_SummarizeCalibration() throws Exception {
        GafCalibrationResult calibration = new GafCalibrationResult(1.1, 3, null, false, "39.7,-105.0", null);
        when(gafReportService.summarize(39.7392, -104.9903, null, 1500.0))
            .thenReturn(new CalibrationSummary(39.7392, -104.9903, "39.7,-105.0", calibration, 3, 1650.0));

        mockMvc.perform(get("/api/calibration")
                .param("lat", "39.7392")
                .param("lng", "-104.9903")
                .param("candidateArea", "1500"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.calibration.calibrationFactor", closeTo(1.1, 1e-9)))
            .andExpect(jsonPath("$.calibratedAreaSqFt", closeTo(1650.0, 1e-9)));
    }
}
