package com.volforecast.engine.infra.disruptor.event;

import com.lmax.disruptor.EventFactory;

public class PriceTickEventFactory implements EventFactory<PriceTickEvent> {

    @Override
    public PriceTickEvent newInstance() {
        return new PriceTickEvent();
    }
}
