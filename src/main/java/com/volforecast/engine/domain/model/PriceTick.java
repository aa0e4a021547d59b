package com.volforecast.engine.domain.model;

public record PriceTick(long timestamp, double price) {
}
