package com.volforecast.engine.domain.model;

/**
 * 충격 분포. STUDENT_T 는 df > 2 (유한 분산) 이어야 하고, GAUSSIAN 은 df 를 사용하지 않는다 (0 으로 기록).
 */
public record DistributionFamily(DistributionKind kind, double degreesOfFreedom) {

    public DistributionFamily {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (kind == DistributionKind.STUDENT_T && !(degreesOfFreedom > 2.0)) {
            throw new IllegalArgumentException("Student-t 자유도는 2보다 커야 합니다: df=" + degreesOfFreedom);
        }
    }

    public static DistributionFamily studentT(double degreesOfFreedom) {
        return new DistributionFamily(DistributionKind.STUDENT_T, degreesOfFreedom);
    }

    public static DistributionFamily gaussian() {
        return new DistributionFamily(DistributionKind.GAUSSIAN, 0.0);
    }

    public boolean isStudentT() {
        return kind == DistributionKind.STUDENT_T;
    }

    /**
     * sqrt(df / (df - 2)): 단위 스케일 Student-t 의 표준편차. 나누면 분산이 1 이 된다.
     */
    public double studentTStdDev() {
        return Math.sqrt(degreesOfFreedom / (degreesOfFreedom - 2.0));
    }
}
