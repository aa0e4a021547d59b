package com.volforecast.engine.api;

import com.volforecast.engine.domain.exception.InvalidScalingException;
import com.volforecast.engine.domain.exception.MarketDataUnavailableException;
import com.volforecast.engine.domain.model.PathEnsemble;
import com.volforecast.engine.domain.service.montecarlo.PathForecastService;
import com.volforecast.engine.domain.service.volatility.VolatilityStateStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ForecastController.class)
class ForecastControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PathForecastService forecastService;

    @MockBean
    private VolatilityStateStore stateStore;

    @Test
    void returnsEnsemble() throws Exception {
        PathEnsemble ensemble = new PathEnsemble("BTC", 0L, 60, 2, 100.0,
                new double[][]{{100.0, 100.0}, {100.0, 101.0}});
        when(forecastService.generate(eq("BTC"), eq(0L), eq(60), eq(2), eq(7L))).thenReturn(ensemble);

        mockMvc.perform(get("/api/forecast/paths")
                        .param("asset", "BTC").param("t0", "0").param("increment", "60")
                        .param("steps", "2").param("seed", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assetId").value("BTC"))
                .andExpect(jsonPath("$.paths[1][1]").value(101.0));
    }

    @Test
    void mapsDomainFailuresToStatusCodes() throws Exception {
        when(forecastService.generate(eq("ETH"), anyLong(), anyInt(), anyInt(), any()))
                .thenThrow(new MarketDataUnavailableException("현재가 없음"));
        when(forecastService.generate(eq("XAU"), anyLong(), anyInt(), anyInt(), any()))
                .thenThrow(new InvalidScalingException("sigma"));
        when(forecastService.generate(eq("DOGE"), anyLong(), anyInt(), anyInt(), any()))
                .thenThrow(new IllegalArgumentException("등록되지 않은 자산: DOGE"));

        mockMvc.perform(get("/api/forecast/paths").param("asset", "ETH").param("t0", "0")
                        .param("increment", "60").param("steps", "2"))
                .andExpect(status().isServiceUnavailable());
        mockMvc.perform(get("/api/forecast/paths").param("asset", "XAU").param("t0", "0")
                        .param("increment", "60").param("steps", "2"))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(get("/api/forecast/paths").param("asset", "DOGE").param("t0", "0")
                        .param("increment", "60").param("steps", "2"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void missingParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/forecast/paths").param("asset", "BTC"))
                .andExpect(status().isBadRequest());
    }
}
