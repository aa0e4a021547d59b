package com.volforecast.engine.api;

import com.volforecast.engine.infra.disruptor.PriceTickPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

@RestController
@RequestMapping("/api/market")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class MarketDataController {

    private final PriceTickPublisher tickPublisher;
    private final Clock clock;

    @PostMapping("/ticks")
    public ResponseEntity<Map<String, Object>> ingest(@RequestBody TickRequest request) {
        if (request.asset() == null || request.asset().isBlank() || request.price() == null) {
            throw new IllegalArgumentException("asset 과 price 는 필수입니다");
        }
        long timestamp = request.timestamp() != null ? request.timestamp() : clock.millis();
        tickPublisher.publish(request.asset(), request.price(), timestamp);
        return ResponseEntity.accepted().body(Map.of(
                "asset", request.asset().toUpperCase(),
                "timestamp", timestamp));
    }

    public record TickRequest(String asset, Double price, Long timestamp) {
    }
}
