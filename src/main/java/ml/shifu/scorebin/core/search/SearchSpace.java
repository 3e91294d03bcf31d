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
package ml.shifu.scorebin.core.search;

import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inclusive ranges of searched hyperparameters, loadable from SearchSpace.json. Missing fields take defaults:
 * 
 * <pre>
 * maxBins          3 .. 10
 * minBinSize       0.01 .. 0.1
 * minEventRateDiff 0.01 .. 0.1
 * gridSize         4 values per continuous range in grid search
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SearchSpace {

    public static final SearchSpace DEFAULT = new SearchSpace(3, 10, 0.01d, 0.1d, 0.01d, 0.1d, 4);

    private final int maxBinsLow;
    private final int maxBinsHigh;
    private final double minBinSizeLow;
    private final double minBinSizeHigh;
    private final double minEventRateDiffLow;
    private final double minEventRateDiffHigh;
    private final int gridSize;

    @JsonCreator
    public SearchSpace(@JsonProperty("maxBinsLow") Integer maxBinsLow,
            @JsonProperty("maxBinsHigh") Integer maxBinsHigh, @JsonProperty("minBinSizeLow") Double minBinSizeLow,
            @JsonProperty("minBinSizeHigh") Double minBinSizeHigh,
            @JsonProperty("minEventRateDiffLow") Double minEventRateDiffLow,
            @JsonProperty("minEventRateDiffHigh") Double minEventRateDiffHigh,
            @JsonProperty("gridSize") Integer gridSize) {
        this.maxBinsLow = maxBinsLow == null ? 3 : maxBinsLow;
        this.maxBinsHigh = maxBinsHigh == null ? 10 : maxBinsHigh;
        this.minBinSizeLow = minBinSizeLow == null ? 0.01d : minBinSizeLow;
        this.minBinSizeHigh = minBinSizeHigh == null ? 0.1d : minBinSizeHigh;
        this.minEventRateDiffLow = minEventRateDiffLow == null ? 0.01d : minEventRateDiffLow;
        this.minEventRateDiffHigh = minEventRateDiffHigh == null ? 0.1d : minEventRateDiffHigh;
        this.gridSize = gridSize == null ? 4 : gridSize;

        checkRange("maxBins", this.maxBinsLow, this.maxBinsHigh);
        checkRange("minBinSize", this.minBinSizeLow, this.minBinSizeHigh);
        checkRange("minEventRateDiff", this.minEventRateDiffLow, this.minEventRateDiffHigh);
        if(this.maxBinsLow < 1) {
            throw new BinningException(BinningErrorCode.ERROR_GRID_SEARCH_CONFIG, "maxBins range should start from 1 "
                    + "at least, but got " + this.maxBinsLow);
        }
        if(this.gridSize < 1) {
            throw new BinningException(BinningErrorCode.ERROR_GRID_SEARCH_CONFIG, "gridSize should be positive.");
        }
    }

    private static void checkRange(String name, double low, double high) {
        if(low < 0d || low > high) {
            throw new BinningException(BinningErrorCode.ERROR_GRID_SEARCH_CONFIG, "Invalid " + name + " range ["
                    + low + ", " + high + "].");
        }
    }

    public int getMaxBinsLow() {
        return maxBinsLow;
    }

    public int getMaxBinsHigh() {
        return maxBinsHigh;
    }

    public double getMinBinSizeLow() {
        return minBinSizeLow;
    }

    public double getMinBinSizeHigh() {
        return minBinSizeHigh;
    }

    public double getMinEventRateDiffLow() {
        return minEventRateDiffLow;
    }

    public double getMinEventRateDiffHigh() {
        return minEventRateDiffHigh;
    }

    public int getGridSize() {
        return gridSize;
    }

    @Override
    public String toString() {
        return "SearchSpace [maxBins=" + maxBinsLow + ".." + maxBinsHigh + ", minBinSize=" + minBinSizeLow + ".."
                + minBinSizeHigh + ", minEventRateDiff=" + minEventRateDiffLow + ".." + minEventRateDiffHigh
                + ", gridSize=" + gridSize + "]";
    }
}
