package com.volforecast.engine.infra.disruptor.event;

public class PriceTickEvent {

    private String assetId;
    private double price;
    private long timestampMs;
    private long ingestNanoTime;

    public void clear() {
        assetId = null;
        price = 0.0;
        timestampMs = 0L;
        ingestNanoTime = 0L;
    }

    public String getAssetId() {
        return assetId;
    }

    public void setAssetId(String assetId) {
        this.assetId = assetId;
    }

    public double getPrice() {
        return price;
    }

    public void setPrice(double price) {
        this.price = price;
    }

    public long getTimestampMs() {
        return timestampMs;
    }

    public void setTimestampMs(long timestampMs) {
        this.timestampMs = timestampMs;
    }

    public long getIngestNanoTime() {
        return ingestNanoTime;
    }

    public void setIngestNanoTime(long ingestNanoTime) {
        this.ingestNanoTime = ingestNanoTime;
    }

    @Override
    public String toString() {
        return "PriceTickEvent{asset=" + assetId + ", price=" + price + ", ts=" + timestampMs + "}";
    }
}
