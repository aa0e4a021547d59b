package com.volforecast.engine.api;

import com.volforecast.engine.domain.model.DiagnosticsReport;
import com.volforecast.engine.domain.model.TuningSuggestion;
import com.volforecast.engine.domain.service.evaluation.CrpsReplayService;
import com.volforecast.engine.domain.service.evaluation.CrpsReplayService.ReplaySummary;
import com.volforecast.engine.domain.service.evaluation.DiagnosticsService;
import com.volforecast.engine.domain.service.governance.TuningAdvisor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/evaluation")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class EvaluationController {

    private final CrpsReplayService replayService;
    private final DiagnosticsService diagnosticsService;
    private final TuningAdvisor tuningAdvisor;

    @PostMapping("/replay")
    public ResponseEntity<ReplaySummary> replay() {
        return ResponseEntity.ok(replayService.replay());
    }

    @GetMapping("/diagnostics")
    public ResponseEntity<DiagnosticsReport> diagnostics(@RequestParam(defaultValue = "7") int windowDays) {
        return ResponseEntity.ok(diagnosticsService.diagnostics(windowOf(windowDays)));
    }

    @GetMapping("/suggestions")
    public ResponseEntity<List<TuningSuggestion>> suggestions(@RequestParam(defaultValue = "30") int windowDays) {
        return ResponseEntity.ok(tuningAdvisor.suggest(windowOf(windowDays)));
    }

    private static Duration windowOf(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("windowDays 는 양수여야 합니다: " + days);
        }
        return Duration.ofDays(days);
    }
}
