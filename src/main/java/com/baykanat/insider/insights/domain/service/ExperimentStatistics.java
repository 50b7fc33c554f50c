package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.config.AppProperties;
import com.baykanat.insider.insights.domain.model.CredibleInterval;
import com.baykanat.insider.insights.domain.model.ExperimentMetricType;
import com.baykanat.insider.insights.domain.model.SignificanceCode;
import com.baykanat.insider.insights.domain.model.VariantCounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.special.Beta;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bayesian experiment istatistikleri. Funnel variant'ları Beta(s+1, f+1), trend variant'ları
 * Gamma(count+1, 1/exposure) posterior ile modellenir. Funnel kazanma olasılıkları 4 variant'a kadar
 * kapalı formdan (log uzayında inclusion-exclusion toplamı), ötesinde Monte Carlo ile hesaplanır.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExperimentStatistics {

    private static final int MAX_EXACT_VARIANTS = 4;
    private static final double LOWER_QUANTILE = 0.025;
    private static final double UPPER_QUANTILE = 0.975;

    private final AppProperties appProperties;

    /** Her variant'ın en iyi olma olasılığı, girdi sırasıyla. */
    public double[] calculateProbabilities(List<VariantCounts> variants) {
        if (!isExact(variants)) {
            log.warn("Falling back to Monte Carlo for {} funnel variants", variants.size());
            return winProbabilities(simulate(betaPosteriors(variants)));
        }
        double[] probabilities = new double[variants.size()];
        for (int target = 0; target < variants.size(); target++) {
            List<VariantCounts> rivals = new ArrayList<>(variants);
            rivals.remove(target);
            probabilities[target] = probabilityBest(variants.get(target), rivals);
        }
        return probabilities;
    }

    /** Kapalı form ancak variant sayısı ve toplam terim sayısı sınır içindeyse kullanılır. */
    public boolean isExact(List<VariantCounts> variants) {
        if (variants.size() > MAX_EXACT_VARIANTS) {
            return false;
        }
        long maxTerms = appProperties.getExperiment().getMaxExactTerms();
        for (int target = 0; target < variants.size(); target++) {
            double terms = 1.0;
            for (int rival = 0; rival < variants.size(); rival++) {
                if (rival != target) {
                    terms *= 1.0 + alpha(variants.get(rival));
                }
            }
            if (terms - 1.0 > maxTerms) {
                return false;
            }
        }
        return true;
    }

    /**
     * target'ı seçmenin beklenen kaybı: E[max(max(others) - target, 0)]. Tek rakipte kapalı form,
     * aksi halde Monte Carlo.
     */
    public double calculateExpectedLoss(VariantCounts target, List<VariantCounts> others) {
        if (others.size() == 1 && isExact(List.of(target, others.get(0)))) {
            VariantCounts rival = others.get(0);
            double aT = alpha(target);
            double bT = beta(target);
            double aR = alpha(rival);
            double bR = beta(rival);
            double loss = aR / (aR + bR) * probabilityGreater(aR + 1, bR, aT, bT)
                    - aT / (aT + bT) * probabilityGreater(aR, bR, aT + 1, bT);
            return Math.max(loss, 0.0);
        }
        List<VariantCounts> all = new ArrayList<>();
        all.add(target);
        all.addAll(others);
        return expectedLoss(simulate(betaPosteriors(all)), 0);
    }

    public List<CredibleInterval> calculateCredibleIntervals(List<VariantCounts> variants) {
        return intervals(betaPosteriors(variants));
    }

    public double[] calculateTrendProbabilities(List<VariantCounts> variants) {
        return winProbabilities(simulate(gammaPosteriors(variants)));
    }

    public double calculateTrendExpectedLoss(VariantCounts target, List<VariantCounts> others) {
        List<VariantCounts> all = new ArrayList<>();
        all.add(target);
        all.addAll(others);
        return expectedLoss(simulate(gammaPosteriors(all)), 0);
    }

    public List<CredibleInterval> calculateTrendCredibleIntervals(List<VariantCounts> variants) {
        return intervals(gammaPosteriors(variants));
    }

    /** Kontroller sırasıyla: veri yok, yetersiz örnek, düşük kazanma olasılığı, yüksek kayıp. */
    public SignificanceCode significance(ExperimentMetricType metricType, List<VariantCounts> variants,
                                         double[] probabilities, double leadingExpectedLoss) {
        AppProperties.ExperimentProperties settings = appProperties.getExperiment();
        if (variants.size() < 2 || variants.stream().allMatch(variant -> sampleSize(metricType, variant) == 0)) {
            return SignificanceCode.NO_RESULTS;
        }
        for (VariantCounts variant : variants) {
            if (sampleSize(metricType, variant) < settings.getMinExposure()) {
                return SignificanceCode.NOT_ENOUGH_DATA;
            }
        }
        double best = 0.0;
        for (double probability : probabilities) {
            best = Math.max(best, probability);
        }
        if (best < settings.getMinProbability()) {
            return SignificanceCode.LOW_WIN_PROBABILITY;
        }
        if (leadingExpectedLoss >= settings.getExpectedLossThreshold()) {
            return SignificanceCode.HIGH_LOSS;
        }
        return SignificanceCode.SIGNIFICANT;
    }

    /**
     * P(X > T), X ~ Beta(aX, bX), T ~ Beta(aT, bT), aX tam sayı:
     * sum_{i=0}^{aX-1} B(aT+i, bT+bX) / ((bX+i) B(1+i, bX) B(aT, bT)).
     */
    static double probabilityGreater(double aX, double bX, double aT, double bT) {
        double total = 0.0;
        double logNormalizer = Beta.logBeta(aT, bT);
        for (int i = 0; i < (int) aX; i++) {
            total += Math.exp(Beta.logBeta(aT + i, bT + bX) - Math.log(bX + i) - Beta.logBeta(1 + i, bX) - logNormalizer);
        }
        return total;
    }

    /**
     * P(target en iyi) = sum_{S ⊆ rivals} (-1)^|S| P(S'teki herkes > target). Her alt küme terimi
     * Beta(a, b) kuyruğunun binom açılımı ile kapalı formda integre edilir.
     */
    private double probabilityBest(VariantCounts target, List<VariantCounts> rivals) {
        double aX = alpha(target);
        double bX = beta(target);
        double probability = 0.0;
        int subsets = 1 << rivals.size();
        for (int mask = 0; mask < subsets; mask++) {
            List<VariantCounts> subset = new ArrayList<>();
            for (int j = 0; j < rivals.size(); j++) {
                if ((mask & (1 << j)) != 0) {
                    subset.add(rivals.get(j));
                }
            }
            int[] alphas = new int[subset.size()];
            int[] trials = new int[subset.size()];
            for (int j = 0; j < subset.size(); j++) {
                alphas[j] = Math.toIntExact((long) alpha(subset.get(j)));
                trials[j] = Math.toIntExact((long) (alpha(subset.get(j)) + beta(subset.get(j)) - 1));
            }
            double allAbove = subset.isEmpty() ? 1.0 : sumTerms(aX, bX, alphas, trials, 0, 0L, 0L, 0.0);
            probability += (subset.size() % 2 == 0 ? 1.0 : -1.0) * allAbove;
        }
        return Math.min(1.0, Math.max(0.0, probability));
    }

    private static double sumTerms(double aX, double bX, int[] alphas, int[] trials, int depth,
                                   long successes, long failures, double logCoefficient) {
        if (depth == alphas.length) {
            return Math.exp(logCoefficient + Beta.logBeta(aX + successes, bX + failures) - Beta.logBeta(aX, bX));
        }
        double total = 0.0;
        int n = trials[depth];
        for (int i = 0; i < alphas[depth]; i++) {
            total += sumTerms(aX, bX, alphas, trials, depth + 1, successes + i, failures + n - i,
                    logCoefficient + CombinatoricsUtils.binomialCoefficientLog(n, i));
        }
        return total;
    }

    private double[][] simulate(List<RealDistribution> posteriors) {
        int simulations = appProperties.getExperiment().getSimulationCount();
        double[][] samples = new double[posteriors.size()][simulations];
        for (int v = 0; v < posteriors.size(); v++) {
            for (int i = 0; i < simulations; i++) {
                samples[v][i] = posteriors.get(v).sample();
            }
        }
        return samples;
    }

    private static double[] winProbabilities(double[][] samples) {
        int variants = samples.length;
        int simulations = samples[0].length;
        double[] wins = new double[variants];
        for (int i = 0; i < simulations; i++) {
            int winner = 0;
            for (int v = 1; v < variants; v++) {
                if (samples[v][i] > samples[winner][i]) {
                    winner = v;
                }
            }
            wins[winner]++;
        }
        for (int v = 0; v < variants; v++) {
            wins[v] /= simulations;
        }
        return wins;
    }

    private static double expectedLoss(double[][] samples, int target) {
        int simulations = samples[target].length;
        double loss = 0.0;
        for (int i = 0; i < simulations; i++) {
            double bestOther = Double.NEGATIVE_INFINITY;
            for (int v = 0; v < samples.length; v++) {
                if (v != target) {
                    bestOther = Math.max(bestOther, samples[v][i]);
                }
            }
            loss += Math.max(0.0, bestOther - samples[target][i]);
        }
        return loss / simulations;
    }

    private static List<CredibleInterval> intervals(List<RealDistribution> posteriors) {
        List<CredibleInterval> intervals = new ArrayList<>(posteriors.size());
        for (RealDistribution posterior : posteriors) {
            intervals.add(new CredibleInterval(
                    posterior.inverseCumulativeProbability(LOWER_QUANTILE),
                    posterior.inverseCumulativeProbability(UPPER_QUANTILE)));
        }
        return intervals;
    }

    private List<RealDistribution> betaPosteriors(List<VariantCounts> variants) {
        RandomGenerator random = randomGenerator();
        List<RealDistribution> posteriors = new ArrayList<>(variants.size());
        for (VariantCounts variant : variants) {
            posteriors.add(new BetaDistribution(random, alpha(variant), beta(variant)));
        }
        return posteriors;
    }

    private List<RealDistribution> gammaPosteriors(List<VariantCounts> variants) {
        RandomGenerator random = randomGenerator();
        List<RealDistribution> posteriors = new ArrayList<>(variants.size());
        for (VariantCounts variant : variants) {
            double exposure = variant.getExposure() > 0 ? variant.getExposure() : 1.0;
            posteriors.add(new GammaDistribution(random, variant.getCount() + 1.0, 1.0 / exposure));
        }
        return posteriors;
    }

    private RandomGenerator randomGenerator() {
        Long seed = appProperties.getExperiment().getSeed();
        return seed != null ? new Well19937c(seed) : new Well19937c();
    }

    private static long sampleSize(ExperimentMetricType metricType, VariantCounts variant) {
        return metricType == ExperimentMetricType.TREND ? variant.getCount() : variant.sampleSize();
    }

    private static double alpha(VariantCounts variant) {
        return variant.getSuccessCount() + 1.0;
    }

    private static double beta(VariantCounts variant) {
        return variant.getFailureCount() + 1.0;
    }
}
