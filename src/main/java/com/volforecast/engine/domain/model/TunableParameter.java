package com.volforecast.engine.domain.model;

import java.util.Arrays;

public enum TunableParameter {

    DECAY_LAMBDA("lambda"),
    DEGREES_OF_FREEDOM("df"),
    DAILY_CAP("sigma_cap_daily");

    private final String key;

    TunableParameter(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * 외부 키("lambda", "df", "sigma_cap_daily") 또는 enum 이름 모두 허용.
     */
    public static TunableParameter fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("파라미터 이름이 비어 있습니다");
        }
        return Arrays.stream(values())
                .filter(p -> p.key.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 파라미터: " + value));
    }
}
