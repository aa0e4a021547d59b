package com.volforecast.engine.api;

import com.volforecast.engine.domain.model.EligibilityDecision;
import com.volforecast.engine.domain.model.ProposalResult;
import com.volforecast.engine.domain.model.TunableParameter;
import com.volforecast.engine.domain.model.TuningHistoryEntry;
import com.volforecast.engine.domain.service.governance.ParameterGovernance;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GovernanceController.class)
class GovernanceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ParameterGovernance governance;

    @Test
    void acceptedProposalReturnsOk() throws Exception {
        TuningHistoryEntry entry = TuningHistoryEntry.builder()
                .entryId("e1").assetId("BTC").parameter(TunableParameter.DECAY_LAMBDA)
                .oldValue(0.94).newValue(0.95).timestampEpochMs(1L).reason("r").build();
        when(governance.proposeChange(eq("BTC"), eq(TunableParameter.DECAY_LAMBDA), eq(0.95), anyString()))
                .thenReturn(ProposalResult.accepted("ok", entry));

        mockMvc.perform(post("/api/governance/proposals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"asset\":\"BTC\",\"parameter\":\"lambda\",\"newValue\":0.95,\"reason\":\"r\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.entry.newValue").value(0.95));
    }

    @Test
    void rejectedProposalReturnsConflict() throws Exception {
        when(governance.proposeChange(eq("BTC"), eq(TunableParameter.DEGREES_OF_FREEDOM), anyDouble(), anyString()))
                .thenReturn(ProposalResult.rejected("관찰 기간"));

        mockMvc.perform(post("/api/governance/proposals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"asset\":\"BTC\",\"parameter\":\"df\",\"newValue\":6,\"reason\":\"r\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.accepted").value(false))
                .andExpect(jsonPath("$.message").value("관찰 기간"));
    }

    @Test
    void unknownParameterIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/governance/proposals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"asset\":\"BTC\",\"parameter\":\"gamma\",\"newValue\":0.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.path").value("/api/governance/proposals"));

        verifyNoInteractions(governance);
    }

    @Test
    void eligibilityIsReported() throws Exception {
        when(governance.checkEligibility("ETH", TunableParameter.DAILY_CAP))
                .thenReturn(new EligibilityDecision(false, "첫 튜닝 대기 기간"));

        mockMvc.perform(get("/api/governance/eligibility").param("asset", "ETH").param("parameter", "sigma_cap_daily"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.eligible").value(false));
    }
}
