package com.volforecast.engine.api;

import com.volforecast.engine.domain.model.EligibilityDecision;
import com.volforecast.engine.domain.model.GovernanceState;
import com.volforecast.engine.domain.model.ProposalResult;
import com.volforecast.engine.domain.model.TunableParameter;
import com.volforecast.engine.domain.model.TuningHistoryEntry;
import com.volforecast.engine.domain.service.governance.ParameterGovernance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/governance")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class GovernanceController {

    private final ParameterGovernance governance;

    @GetMapping("/eligibility")
    public ResponseEntity<EligibilityDecision> eligibility(@RequestParam String asset,
                                                           @RequestParam String parameter) {
        return ResponseEntity.ok(governance.checkEligibility(asset, TunableParameter.fromKey(parameter)));
    }

    @GetMapping("/state")
    public ResponseEntity<GovernanceState> state(@RequestParam String asset, @RequestParam String parameter) {
        return ResponseEntity.ok(governance.state(asset, TunableParameter.fromKey(parameter)));
    }

    @GetMapping("/values")
    public ResponseEntity<Map<String, Map<String, Double>>> values() {
        return ResponseEntity.ok(governance.currentValues());
    }

    @PostMapping("/proposals")
    public ResponseEntity<ProposalResult> propose(@RequestBody ProposalRequest request) {
        if (request.asset() == null || request.parameter() == null || request.newValue() == null) {
            throw new IllegalArgumentException("asset, parameter, newValue 는 필수입니다");
        }
        log.info("[Governance API] 변경 제안: asset={}, parameter={}, newValue={}",
                request.asset(), request.parameter(), request.newValue());
        ProposalResult result = governance.proposeChange(request.asset(),
                TunableParameter.fromKey(request.parameter()), request.newValue(), request.reason());
        return ResponseEntity.status(result.accepted() ? HttpStatus.OK : HttpStatus.CONFLICT).body(result);
    }

    @GetMapping("/history")
    public ResponseEntity<List<TuningHistoryEntry>> history() {
        return ResponseEntity.ok(governance.history());
    }

    public record ProposalRequest(String asset, String parameter, Double newValue, String reason) {
    }
}
