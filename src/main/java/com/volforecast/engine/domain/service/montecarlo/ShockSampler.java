package com.volforecast.engine.domain.service.montecarlo;

import com.volforecast.engine.domain.model.DistributionFamily;
import org.springframework.stereotype.Component;

import java.util.SplittableRandom;

/**
 * 로그수익률 충격을 한 번에 뽑는다. 결과의 표준편차는 분포와 무관하게 sigma.
 * <ul>
 *   <li>GAUSSIAN: sigma * z</li>
 *   <li>STUDENT_T: sigma / sqrt(df/(df-2)) * z / sqrt(chi2/df), chi2 = 2 * Gamma(df/2)</li>
 * </ul>
 */
@Component
public class ShockSampler {

    public double[] sample(DistributionFamily family, double sigma, int count, SplittableRandom rng) {
        double[] shocks = new double[count];
        if (family.isStudentT()) {
            double df = family.degreesOfFreedom();
            double scale = sigma / family.studentTStdDev();
            for (int i = 0; i < count; i++) {
                double z = rng.nextGaussian();
                double chiSq = 2.0 * sampleGamma(df / 2.0, rng);
                shocks[i] = scale * z / Math.sqrt(chiSq / df);
            }
        } else {
            for (int i = 0; i < count; i++) {
                shocks[i] = sigma * rng.nextGaussian();
            }
        }
        return shocks;
    }

    // Marsaglia-Tsang, shape >= 1 (df > 2 이므로 항상 성립)
    static double sampleGamma(double shape, SplittableRandom rng) {
        if (shape < 1.0) {
            double u = rng.nextDouble();
            return sampleGamma(shape + 1.0, rng) * Math.pow(u, 1.0 / shape);
        }
        double d = shape - 1.0 / 3.0;
        double c = 1.0 / Math.sqrt(9.0 * d);
        while (true) {
            double x = rng.nextGaussian();
            double v = 1.0 + c * x;
            if (v <= 0) continue;
            v = v * v * v;
            double u = rng.nextDouble();
            double x2 = x * x;
            if (u < 1.0 - 0.0331 * x2 * x2) return d * v;
            if (Math.log(u) < 0.5 * x2 + d * (1.0 - v + Math.log(v))) return d * v;
        }
    }
}
