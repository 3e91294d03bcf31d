/*
 * Copyright [2013-2016] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.scorebin.core.stability;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import ml.shifu.scorebin.ObservationFixture;
import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.container.obj.PsiAggregation;
import ml.shifu.scorebin.core.binning.obj.BinSet;
import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;
import ml.shifu.scorebin.exception.EmptyCohortException;
import ml.shifu.scorebin.exception.InsufficientDataException;

import org.testng.Assert;
import org.testng.annotations.Test;

public class StabilityScorerTest {

    private static final BinSet TWO_BINS = BinSet.fromThresholds(Arrays.asList(1d));

    /**
     * Two bins, 10 observations per cell; events[bin][cohort].
     */
    private static List<Observation> twoBins(String[] cohorts, int[][] events) {
        List<Observation> observations = new ArrayList<Observation>();
        for(int bin = 0; bin < events.length; bin++) {
            for(int cohort = 0; cohort < cohorts.length; cohort++) {
                ObservationFixture.addNumeric(observations, bin + 0.5d, cohorts[cohort], 10, events[bin][cohort]);
            }
        }
        return observations;
    }

    private static StabilityMetrics score(List<Observation> observations, BinningConfig config) {
        return StabilityScorer.score(CohortAggregator.aggregate(TWO_BINS, observations), config);
    }

    @Test
    public void testSeparabilityAndPsi() {
        StabilityMetrics metrics = score(twoBins(new String[] { "a", "b" }, new int[][] { { 1, 2 }, { 3, 5 } }),
                BinningConfig.DEFAULT);

        Assert.assertTrue(metrics.isStabilityChecked());
        Assert.assertEquals(metrics.getSeparability(), 0.25d, 1e-12);
        Assert.assertEquals(metrics.getReferenceCohort(), "a");
        Assert.assertEquals(metrics.getPsiByCohort().keySet(), new HashSet<String>(Arrays.asList("b")));
        // same population shares in both cohorts
        Assert.assertEquals(metrics.getPsiMean(), 0d);
        Assert.assertEquals(metrics.getPsiMax(), 0d);
        Assert.assertTrue(metrics.getSubstitutions().isEmpty());

        Assert.assertEquals(metrics.getKs(), 17d / 29d - 3d / 11d, 1e-12);
        Assert.assertEquals(metrics.getEventRateSeries().get(1), Arrays.asList(0.3d, 0.5d));
        Assert.assertEquals(metrics.getEventRateStd().get(0), Math.sqrt(0.005d), 1e-12);
        Assert.assertEquals(metrics.getEventRateRange().get(1), 0.2d, 1e-12);
    }

    @Test
    public void testIdenticalRatesGiveZeroSeparability() {
        StabilityMetrics metrics = score(twoBins(new String[] { "a", "b", "c" }, new int[][] { { 2, 2, 2 },
                { 2, 2, 2 } }), BinningConfig.DEFAULT);
        Assert.assertEquals(metrics.getSeparability(), 0d);
        Assert.assertEquals(metrics.getPsiMean(), 0d);
        Assert.assertEquals(metrics.getKs(), 0d, 1e-12);
    }

    @Test
    public void testCohortRelabelling() {
        int[][] events = new int[][] { { 1, 4 }, { 6, 9 } };
        StabilityMetrics metrics = score(twoBins(new String[] { "a", "b" }, events), BinningConfig.DEFAULT);
        // relabelled in reversed order
        StabilityMetrics relabelled = score(twoBins(new String[] { "z", "y" }, events), BinningConfig.DEFAULT);
        Assert.assertEquals(relabelled.getSeparability(), metrics.getSeparability(), 1e-12);
        Assert.assertEquals(relabelled.getKs(), metrics.getKs(), 1e-12);
    }

    @Test
    public void testPsiKeptUnderOrderPreservingRelabel() {
        String[] cohorts = new String[] { "a", "b", "c" };
        String[] renamed = new String[] { "m1", "m2", "m3" };
        int[][] counts = new int[][] { { 50, 70, 20 }, { 30, 15, 60 } };
        List<Observation> observations = new ArrayList<Observation>();
        List<Observation> relabelled = new ArrayList<Observation>();
        for(int bin = 0; bin < counts.length; bin++) {
            for(int cohort = 0; cohort < cohorts.length; cohort++) {
                int events = counts[bin][cohort] / (5 - 2 * bin);
                ObservationFixture.addNumeric(observations, bin + 0.5d, cohorts[cohort], counts[bin][cohort], events);
                ObservationFixture.addNumeric(relabelled, bin + 0.5d, renamed[cohort], counts[bin][cohort], events);
            }
        }

        StabilityMetrics metrics = score(observations, BinningConfig.DEFAULT);
        StabilityMetrics other = score(relabelled, BinningConfig.DEFAULT);
        Assert.assertTrue(metrics.getPsiMax() > 0d);
        Assert.assertEquals(other.getReferenceCohort(), "m1");
        Assert.assertEquals(other.getPsiMean(), metrics.getPsiMean(), 1e-12);
        Assert.assertEquals(other.getPsiMax(), metrics.getPsiMax(), 1e-12);
        Assert.assertEquals(other.getPsiByCohort().get("m2"), metrics.getPsiByCohort().get("b"), 1e-12);
        Assert.assertEquals(other.getPsiByCohort().get("m3"), metrics.getPsiByCohort().get("c"), 1e-12);
        Assert.assertEquals(other.getSeparability(), metrics.getSeparability(), 1e-12);
        Assert.assertEquals(other.getKs(), metrics.getKs(), 1e-12);
    }

    @Test
    public void testLowFrequencySkipsMissingCells() {
        BinningConfig config = BinningConfig.builder().penalizeLowFrequency(true).penalty(0.1d).build();

        List<Observation> observations = new ArrayList<Observation>();
        ObservationFixture.addNumeric(observations, 0.5d, "a", 50, 5);
        ObservationFixture.addNumeric(observations, 0.5d, "b", 50, 10);
        ObservationFixture.addNumeric(observations, 1.5d, "a", 50, 25);
        double plain = score(observations, BinningConfig.DEFAULT).getSeparability();
        // bin 1 is missing in cohort b but has 50 observations in a
        Assert.assertEquals(score(observations, config).getSeparability(), plain, 1e-12);

        ObservationFixture.addNumeric(observations, 1.5d, "c", 10, 5);
        ObservationFixture.addNumeric(observations, 0.5d, "c", 50, 5);
        double withSmallCell = score(observations, BinningConfig.DEFAULT).getSeparability();
        Assert.assertEquals(score(observations, config).getSeparability(), withSmallCell - 0.1d, 1e-12);
    }

    @Test
    public void testEmptyCellIsFlooredAndReported() {
        List<Observation> observations = new ArrayList<Observation>();
        ObservationFixture.addNumeric(observations, 0.5d, "a", 10, 1);
        ObservationFixture.addNumeric(observations, 1.5d, "a", 10, 5);
        ObservationFixture.addNumeric(observations, 0.5d, "b", 10, 3);

        StabilityMetrics metrics = score(observations, BinningConfig.DEFAULT);
        double expected = (1d - 0.5d) * Math.log(2d) + (1e-4 - 0.5d) * Math.log(1e-4 / 0.5d);
        Assert.assertEquals(metrics.getPsiMean(), expected, 1e-12);
        Assert.assertTrue(metrics.getPsiMean() > 0d);

        Assert.assertEquals(metrics.getSubstitutions().size(), 1);
        GuardSubstitution substitution = metrics.getSubstitutions().get(0);
        Assert.assertEquals(substitution.getMetric(), GuardSubstitution.PSI);
        Assert.assertEquals(substitution.getBinIndex(), 1);
        Assert.assertEquals(substitution.getCohortId(), "b");
        Assert.assertEquals(substitution.getOriginalValue(), 0d);
        Assert.assertEquals(substitution.getSubstitutedValue(), 1e-4);

        Assert.assertEquals(metrics.getUndefinedCells().size(), 1);
        Assert.assertEquals(metrics.getUndefinedCells().get(0).getCohortId(), "b");
        // only cohort a defines both rates
        Assert.assertEquals(metrics.getSeparability(), 0.4d, 1e-12);
    }

    @Test
    public void testPsiAggregation() {
        List<Observation> observations = new ArrayList<Observation>();
        ObservationFixture.addNumeric(observations, 0.5d, "a", 50, 5);
        ObservationFixture.addNumeric(observations, 1.5d, "a", 50, 20);
        ObservationFixture.addNumeric(observations, 0.5d, "b", 60, 6);
        ObservationFixture.addNumeric(observations, 1.5d, "b", 40, 16);
        ObservationFixture.addNumeric(observations, 0.5d, "c", 80, 8);
        ObservationFixture.addNumeric(observations, 1.5d, "c", 20, 8);

        StabilityMetrics metrics = score(observations, BinningConfig.DEFAULT);
        Assert.assertEquals(metrics.getPsiByCohort().size(), 2);
        Assert.assertTrue(metrics.getPsiByCohort().get("c") > metrics.getPsiByCohort().get("b"));
        Assert.assertEquals(metrics.getPsiMax(), metrics.getPsiByCohort().get("c"));
        Assert.assertEquals(metrics.getPsi(PsiAggregation.MAX), metrics.getPsiMax());
        Assert.assertEquals(metrics.getPsi(PsiAggregation.MEAN), metrics.getPsiMean());
        Assert.assertTrue(metrics.getPsiMean() < metrics.getPsiMax());
    }

    @Test
    public void testReferenceCohort() {
        List<Observation> observations = twoBins(new String[] { "a", "b", "c" }, new int[][] { { 1, 2, 1 },
                { 3, 5, 4 } });
        StabilityMetrics metrics = score(observations, BinningConfig.builder().referenceCohort("b").build());
        Assert.assertEquals(metrics.getReferenceCohort(), "b");
        Assert.assertEquals(new ArrayList<String>(metrics.getPsiByCohort().keySet()), Arrays.asList("a", "c"));

        try {
            score(observations, BinningConfig.builder().referenceCohort("zzz").build());
            Assert.fail("unknown reference cohort should be rejected");
        } catch (BinningException e) {
            Assert.assertEquals(e.getError(), BinningErrorCode.ERROR_REFERENCE_COHORT_NOT_FOUND);
        }
    }

    @Test
    public void testStabilityNotChecked() {
        StabilityMetrics metrics = score(twoBins(new String[] { "a" }, new int[][] { { 1 }, { 6 } }), BinningConfig
                .builder().checkStability(false).build());
        Assert.assertFalse(metrics.isStabilityChecked());
        Assert.assertEquals(metrics.getPsiMean(), 0d);
        Assert.assertEquals(metrics.getSeparability(), 0d);
        Assert.assertEquals(metrics.getKs(), 9d / 13d - 1d / 7d, 1e-12);
    }

    @Test(expectedExceptions = EmptyCohortException.class)
    public void testSingleCohort() {
        score(twoBins(new String[] { "a" }, new int[][] { { 1 }, { 6 } }), BinningConfig.DEFAULT);
    }

    @Test(expectedExceptions = InsufficientDataException.class)
    public void testEmptyBin() {
        List<Observation> observations = new ArrayList<Observation>();
        ObservationFixture.addNumeric(observations, 0.5d, "a", 10, 1);
        ObservationFixture.addNumeric(observations, 0.5d, "b", 10, 2);
        StabilityScorer.score(CohortAggregator.aggregate(TWO_BINS, observations), BinningConfig.DEFAULT);
    }

    @Test
    public void testInversionPenalty() {
        int[][] events = new int[][] { { 1, 2, 1 }, { 5, 5, 5 } };
        String[] cohorts = new String[] { "a", "b", "c" };
        double plain = score(twoBins(cohorts, events), BinningConfig.DEFAULT).getSeparability();
        Assert.assertEquals(plain, (0.4d + 0.3d + 0.4d) / 3d, 1e-12);

        double penalized = score(twoBins(cohorts, events),
                BinningConfig.builder().penalizeInversions(true).penalty(0.1d).build()).getSeparability();
        Assert.assertEquals(penalized, plain - 0.1d, 1e-12);

        // 10 observations per cell, both bins under 30
        double lowFrequency = score(twoBins(cohorts, events),
                BinningConfig.builder().penalizeLowFrequency(true).penalty(0.1d).build()).getSeparability();
        Assert.assertEquals(lowFrequency, plain - 0.2d, 1e-12);
    }

    @Test
    public void testCountInversions() {
        List<List<Double>> series = new ArrayList<List<Double>>();
        series.add(Arrays.asList(0.1d, 0.2d, 0.1d));
        series.add(Arrays.asList(0.1d, 0.2d, 0.3d));
        series.add(Arrays.asList(0.3d, Double.NaN, 0.2d, 0.1d));
        Assert.assertEquals(StabilityScorer.countInversions(series), 1);
    }
}
