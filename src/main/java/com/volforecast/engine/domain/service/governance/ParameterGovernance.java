package com.volforecast.engine.domain.service.governance;

import com.volforecast.engine.domain.exception.GovernanceRejectedException;
import com.volforecast.engine.domain.model.DistributionKind;
import com.volforecast.engine.domain.model.EligibilityDecision;
import com.volforecast.engine.domain.model.GovernanceState;
import com.volforecast.engine.domain.model.ProposalResult;
import com.volforecast.engine.domain.model.TunableParameter;
import com.volforecast.engine.domain.model.TuningHistoryEntry;
import com.volforecast.engine.domain.repository.TuningLedgerRepository;
import com.volforecast.engine.domain.service.AssetParameterRegistry;
import com.volforecast.engine.domain.service.governance.GovernanceProperties.ParameterBounds;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 파라미터 변경의 유일한 경로. 제안은 자산별로 직렬화되고, 채택 시 원장에 먼저 기록한 뒤 레지스트리 값을 바꾼다.
 * 거부된 제안은 상태도 원장도 건드리지 않는다.
 */
@Slf4j
@Service
public class ParameterGovernance {

    static final double STEP_TOLERANCE = 1e-9;

    private final TuningLedgerRepository ledgerRepository;
    private final AssetParameterRegistry registry;
    private final GovernanceRules rules;
    private final GovernanceProperties properties;
    private final Clock clock;
    private final Counter acceptedCounter;
    private final Counter rejectedCounter;

    private final Map<String, ReentrantLock> assetLocks = new ConcurrentHashMap<>();
    private final Map<String, TunableParameter> inFlight = new ConcurrentHashMap<>();

    public ParameterGovernance(TuningLedgerRepository ledgerRepository,
                               AssetParameterRegistry registry,
                               GovernanceRules rules,
                               GovernanceProperties properties,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.ledgerRepository = ledgerRepository;
        this.registry = registry;
        this.rules = rules;
        this.properties = properties;
        this.clock = clock;
        this.acceptedCounter = Counter.builder("forecast.governance.proposals")
                .tag("outcome", "accepted")
                .register(meterRegistry);
        this.rejectedCounter = Counter.builder("forecast.governance.proposals")
                .tag("outcome", "rejected")
                .register(meterRegistry);
    }

    public GovernanceState state(String assetId, TunableParameter parameter) {
        registry.profile(assetId);
        if (inFlight.get(AssetParameterRegistry.normalize(assetId)) == parameter) {
            return GovernanceState.proposed();
        }
        return rules.derive(ledgerRepository.findAll(), ledgerRepository.startedAtEpochMs(),
                clock.millis(), assetId, parameter);
    }

    public EligibilityDecision checkEligibility(String assetId, TunableParameter parameter) {
        GovernanceState state = state(assetId, parameter);
        if (state.isEligible()) {
            return new EligibilityDecision(true, "변경 가능");
        }
        String until = state.untilEpochMs() != null ? Instant.ofEpochMilli(state.untilEpochMs()).toString() : "-";
        String reason = state.isObserving()
                ? "관찰 기간 진행 중 (종료: " + until + ")"
                : state.reason() + " (가능 시점: " + until + ")";
        return new EligibilityDecision(false, reason);
    }

    public Map<String, Map<String, Double>> currentValues() {
        return registry.currentValues();
    }

    public List<TuningHistoryEntry> history() {
        return ledgerRepository.findAll();
    }

    public ProposalResult proposeChange(String assetId, TunableParameter parameter, double newValue, String reason) {
        registry.profile(assetId);
        String asset = AssetParameterRegistry.normalize(assetId);
        ReentrantLock lock = assetLocks.computeIfAbsent(asset, k -> new ReentrantLock());
        lock.lock();
        try {
            String rejection = validate(asset, parameter, newValue);
            if (rejection != null) {
                rejectedCounter.increment();
                log.info("[Governance] 제안 거부: asset={}, parameter={}, value={}, reason={}",
                        asset, parameter.getKey(), newValue, rejection);
                return ProposalResult.rejected(rejection);
            }

            double oldValue = registry.currentValue(asset, parameter);
            long now = clock.millis();
            TuningHistoryEntry entry = TuningHistoryEntry.builder()
                    .entryId(UUID.randomUUID().toString())
                    .assetId(asset)
                    .parameter(parameter)
                    .oldValue(oldValue)
                    .newValue(newValue)
                    .timestampEpochMs(now)
                    .reason(reason)
                    .build();

            log.debug("[Governance] PROPOSED: asset={}, parameter={}, {} -> {}", asset, parameter.getKey(), oldValue, newValue);
            inFlight.put(asset, parameter);
            try {
                ledgerRepository.append(entry);
                registry.applyOverride(asset, parameter, newValue);
            } finally {
                inFlight.remove(asset);
            }
            acceptedCounter.increment();

            long observeUntil = now + properties.getObservationPeriod().toMillis();
            log.info("[Governance] 변경 채택: asset={}, parameter={}, {} -> {}, reason={}, observeUntil={}",
                    asset, parameter.getKey(), oldValue, newValue, reason, Instant.ofEpochMilli(observeUntil));
            return ProposalResult.accepted("변경 채택, 관찰 기간 종료: " + Instant.ofEpochMilli(observeUntil), entry);
        } finally {
            lock.unlock();
        }
    }

    public TuningHistoryEntry applyChange(String assetId, TunableParameter parameter, double newValue, String reason) {
        ProposalResult result = proposeChange(assetId, parameter, newValue, reason);
        if (!result.accepted()) {
            throw new GovernanceRejectedException(result.message());
        }
        return result.entry();
    }

    private String validate(String asset, TunableParameter parameter, double newValue) {
        if (!Double.isFinite(newValue)) {
            return "값이 유한하지 않습니다: " + newValue;
        }
        if (parameter == TunableParameter.DEGREES_OF_FREEDOM
                && registry.distributionKind(asset) == DistributionKind.GAUSSIAN) {
            return "정규분포 자산에는 자유도가 적용되지 않습니다";
        }

        List<TuningHistoryEntry> ledger = ledgerRepository.findAll();
        long startedAt = ledgerRepository.startedAtEpochMs();
        long now = clock.millis();

        GovernanceState state = rules.derive(ledger, startedAt, now, asset, parameter);
        if (!state.isEligible()) {
            return "변경 가능 상태가 아닙니다: " + state.phase()
                    + (state.reason() != null ? " (" + state.reason() + ")" : "");
        }
        for (TunableParameter other : TunableParameter.values()) {
            if (other == parameter) continue;
            if (rules.derive(ledger, startedAt, now, asset, other).isObserving()) {
                return "같은 자산의 " + other.getKey() + " 가 관찰 기간 중입니다";
            }
        }

        ParameterBounds bounds = properties.bounds(parameter);
        if (!bounds.contains(newValue)) {
            return "허용 범위를 벗어났습니다: [" + bounds.getMin() + ", " + bounds.getMax() + "]";
        }
        if (bounds.isIntegerOnly() && newValue != Math.rint(newValue)) {
            return parameter.getKey() + " 는 정수만 허용됩니다: " + newValue;
        }

        double current = registry.currentValue(asset, parameter);
        double delta = Math.abs(newValue - current);
        if (delta < STEP_TOLERANCE) {
            return "현재 값과 같습니다: " + current;
        }
        if (delta > bounds.getMaxStep() + STEP_TOLERANCE) {
            return "변경 폭이 최대 허용치(" + bounds.getMaxStep() + ")를 초과합니다: " + current + " -> " + newValue;
        }
        return null;
    }
}
