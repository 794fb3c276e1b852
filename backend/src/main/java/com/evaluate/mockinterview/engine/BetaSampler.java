package com.evaluate.mockinterview.engine;

import com.evaluate.mockinterview.domain.ArmStats;

import java.util.random.RandomGenerator;

/**
 * Draws from Beta(alpha, beta) as X / (X + Y) with X ~ Gamma(alpha), Y ~ Gamma(beta).
 * Gamma variates use Marsaglia and Tsang's squeeze method.
 */
final class BetaSampler {

    private BetaSampler() {
    }

    static double sample(RandomGenerator random, ArmStats arm) {
        return sample(random, arm.alpha(), arm.beta());
    }

    static double sample(RandomGenerator random, double alpha, double beta) {
        if (alpha <= 0 || beta <= 0) {
            throw new IllegalArgumentException("Beta parameters must be positive: " + alpha + ", " + beta);
        }
        double x = gamma(random, alpha);
        double y = gamma(random, beta);
        double sum = x + y;
        return sum == 0 ? 0.5 : x / sum;
    }

    static double gamma(RandomGenerator random, double shape) {
        if (shape < 1.0) {
            // Boost: Gamma(a) = Gamma(a + 1) * U^(1/a)
            double u = random.nextDouble();
            return gamma(random, shape + 1.0) * Math.pow(u, 1.0 / shape);
        }
        double d = shape - 1.0 / 3.0;
        double c = 1.0 / Math.sqrt(9.0 * d);
        while (true) {
            double x;
            double v;
            do {
                x = random.nextGaussian();
                v = 1.0 + c * x;
            } while (v <= 0);
            v = v * v * v;
            double u = random.nextDouble();
            if (u < 1.0 - 0.0331 * x * x * x * x) {
                return d * v;
            }
            if (Math.log(u) < 0.5 * x * x + d * (1.0 - v + Math.log(v))) {
                return d * v;
            }
        }
    }
}
