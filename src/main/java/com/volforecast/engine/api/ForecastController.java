package com.volforecast.engine.api;

import com.volforecast.engine.domain.model.PathEnsemble;
import com.volforecast.engine.domain.model.VolatilityState;
import com.volforecast.engine.domain.service.montecarlo.PathForecastService;
import com.volforecast.engine.domain.service.volatility.VolatilityStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/forecast")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ForecastController {

    private final PathForecastService forecastService;
    private final VolatilityStateStore stateStore;

    @GetMapping("/paths")
    public ResponseEntity<PathEnsemble> paths(@RequestParam String asset,
                                              @RequestParam long t0,
                                              @RequestParam int increment,
                                              @RequestParam int steps,
                                              @RequestParam(required = false) Long seed) {
        log.debug("[Forecast API] 경로 요청: asset={}, t0={}, increment={}, steps={}, seed={}",
                asset, t0, increment, steps, seed);
        return ResponseEntity.ok(forecastService.generate(asset, t0, increment, steps, seed));
    }

    @GetMapping("/volatility")
    public ResponseEntity<VolatilityState> volatility(@RequestParam String asset) {
        return ResponseEntity.ok(stateStore.get(asset));
    }
}
