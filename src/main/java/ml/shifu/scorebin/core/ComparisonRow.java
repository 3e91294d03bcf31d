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
package ml.shifu.scorebin.core;

import ml.shifu.scorebin.exception.BinningErrorCode;

/**
 * One row of {@link BinComparator} output. Metrics are NaN when the fit failed.
 */
public final class ComparisonRow {

    private final String name;

    private final int binCount;

    private final double iv;

    private final double ks;

    private final double psiMean;

    private final double separability;

    private final double score;

    private final BinningErrorCode error;

    private final String message;

    private ComparisonRow(String name, int binCount, double iv, double ks, double psiMean, double separability,
            double score, BinningErrorCode error, String message) {
        this.name = name;
        this.binCount = binCount;
        this.iv = iv;
        this.ks = ks;
        this.psiMean = psiMean;
        this.separability = separability;
        this.score = score;
        this.error = error;
        this.message = message;
    }

    static ComparisonRow success(String name, BinningResult result) {
        return new ComparisonRow(name, result.getBinSet().size(), result.getIv(), result.getKs(), result
                .getStabilityMetrics().getPsiMean(), result.getStabilityMetrics().getSeparability(),
                result.getScore(), null, null);
    }

    static ComparisonRow failure(String name, BinningErrorCode error, String message) {
        return new ComparisonRow(name, 0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, error, message);
    }

    public String getName() {
        return name;
    }

    public int getBinCount() {
        return binCount;
    }

    public double getIv() {
        return iv;
    }

    public double getKs() {
        return ks;
    }

    public double getPsiMean() {
        return psiMean;
    }

    public double getSeparability() {
        return separability;
    }

    public double getScore() {
        return score;
    }

    public BinningErrorCode getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public String toString() {
        if(!isSuccess()) {
            return name + "\tFAILED\t" + error;
        }
        return name + "\t" + binCount + "\t" + iv + "\t" + ks + "\t" + psiMean + "\t" + separability + "\t" + score;
    }
}
