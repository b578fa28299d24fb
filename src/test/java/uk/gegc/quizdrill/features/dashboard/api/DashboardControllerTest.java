package uk.gegc.quizdrill.features.dashboard.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.quizdrill.features.dashboard.application.DashboardService;
import uk.gegc.quizdrill.features.dashboard.application.dto.DashboardSummaryDto;
import uk.gegc.quizdrill.shared.exception.StorageException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.hamcrest.Matchers.endsWith;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DashboardController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("DashboardController")
class DashboardControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DashboardService dashboardService;

    @Test
    @DisplayName("GET /api/v1/dashboard returns the summary")
    void getSummary_returnsCounts() throws Exception {
        when(dashboardService.summary()).thenReturn(
                new DashboardSummaryDto(12, 0, List.of("Asset Security", "Networking"), List.of()));

        mockMvc.perform(get("/api/v1/dashboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.questionCount").value(12))
                .andExpect(jsonPath("$.wrongCount").value(0))
                .andExpect(jsonPath("$.domains[1]").value("Networking"));
    }

    @Test
    @DisplayName("storage failures surface as 500 without leaking the file path")
    void getSummary_storageFailure_internalError() throws Exception {
        when(dashboardService.summary())
                .thenThrow(new StorageException(Path.of("/data/questions.json"), new IOException("disk full")));

        mockMvc.perform(get("/api/v1/dashboard"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value(endsWith("/storage-failed")))
                .andExpect(jsonPath("$.detail").value("Could not persist changes"));
    }
}
