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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedMap;
import java.util.TreeMap;

import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;
import ml.shifu.scorebin.util.Constants;
import ml.shifu.scorebin.util.Environment;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;

/**
 * Grid search over hyperparameters set by List: [..., ..., ...].
 * 
 * <p>
 * Grid is either the cartesian product of list valued params, flattened in sorted param name order, or the lines of
 * a grid search file, each line like {@code maxBins:5;minBinSize:0.05;minEventRateDiff:0.02}.
 * 
 * <p>
 * If the grid is larger than {@code scorebin.gridsearch.threshold} (default 30), a fixed, evenly spread subset of
 * threshold size is kept, so calling twice returns the same vectors.
 */
public class GridSearch implements HyperParamSampler {

    protected static final Logger LOG = LoggerFactory.getLogger(GridSearch.class);

    private static final Splitter PARAM_SPLITTER = Splitter.on(';').trimResults().omitEmptyStrings();

    /**
     * All kinds of hyper parameter composites, sorted by name + order in each parameter.
     */
    private List<Map<String, Object>> flattenParams = new ArrayList<Map<String, Object>>();

    /**
     * How many hyper parameters are list valued
     */
    private int hyperParamCount;

    /**
     * @param rawParams
     *            param name to a single value or a list of values
     */
    public GridSearch(Map<String, Object> rawParams) {
        parseParams(rawParams);
        checkParamsThreshold();
        validate();
    }

    /**
     * @param configFileContent
     *            raw grid search file contents with each line as a String, each line contains one or more
     *            {param name}:{param value} groups concated with ';'
     */
    public GridSearch(List<String> configFileContent) {
        for(String configLine: configFileContent) {
            Map<String, Object> paramsMap = parseParams(configLine);
            if(paramsMap != null) {
                this.flattenParams.add(paramsMap);
            }
        }
        this.hyperParamCount = this.flattenParams.isEmpty() ? 0 : this.flattenParams.get(0).size();
        checkParamsThreshold();
        validate();
    }

    /**
     * Grid of every maxBins in range, and {@link SearchSpace#getGridSize()} evenly spaced values of each continuous
     * range.
     */
    public static GridSearch fromSearchSpace(SearchSpace space) {
        List<Object> maxBins = new ArrayList<Object>();
        for(int i = space.getMaxBinsLow(); i <= space.getMaxBinsHigh(); i++) {
            maxBins.add(i);
        }
        Map<String, Object> rawParams = new HashMap<String, Object>();
        rawParams.put(Constants.MAX_BINS, maxBins);
        rawParams.put(Constants.MIN_BIN_SIZE,
                linspace(space.getMinBinSizeLow(), space.getMinBinSizeHigh(), space.getGridSize()));
        rawParams.put(Constants.MIN_EVENT_RATE_DIFF,
                linspace(space.getMinEventRateDiffLow(), space.getMinEventRateDiffHigh(), space.getGridSize()));
        return new GridSearch(rawParams);
    }

    private static List<Object> linspace(double low, double high, int size) {
        List<Object> values = new ArrayList<Object>(size);
        if(size == 1 || low == high) {
            values.add(low);
            return values;
        }
        double step = (high - low) / (size - 1);
        for(int i = 0; i < size; i++) {
            values.add(i == size - 1 ? high : low + i * step);
        }
        return values;
    }

    private Map<String, Object> parseParams(String configLine) {
        if(StringUtils.isBlank(configLine)) {
            return null;
        }
        Map<String, Object> paramsMap = new HashMap<String, Object>();
        for(String element: PARAM_SPLITTER.split(configLine)) {
            int splitpos = element.indexOf(':');
            if(splitpos == -1) {
                LOG.error("Error exists in grid search file. Line content: {}. Params should be in "
                        + "<param name>:<param value> format, concated with ';'", configLine);
                return null;
            }
            String itemKey = element.substring(0, splitpos).trim();
            String itemValueStr = element.substring(splitpos + 1).trim();
            paramsMap.put(itemKey, convertItemValue(itemKey, itemValueStr));
        }
        return paramsMap;
    }

    private Object convertItemValue(String itemKey, String itemValueStr) {
        try {
            if(Constants.MAX_BINS.equals(itemKey)) {
                return Integer.parseInt(itemValueStr);
            } else if(Constants.MIN_BIN_SIZE.equals(itemKey) || Constants.MIN_EVENT_RATE_DIFF.equals(itemKey)) {
                return Double.parseDouble(itemValueStr);
            }
        } catch (NumberFormatException e) {
            String message = String.format("Search param %s should be a number, actual value got is %s", itemKey,
                    itemValueStr);
            LOG.error(message);
            throw new BinningException(BinningErrorCode.ERROR_GRID_SEARCH_CONFIG, e, message);
        }
        throw new BinningException(BinningErrorCode.ERROR_GRID_SEARCH_CONFIG, "Search param name not recognized: "
                + itemKey);
    }

    @SuppressWarnings("rawtypes")
    private void parseParams(Map<String, Object> params) {
        // sorted by natural order, this makes all flatten parameters sorted and fixed
        SortedMap<String, Object> sortedMap = new TreeMap<String, Object>(params);
        List<Integer> hyperParamCntList = new ArrayList<Integer>();
        Map<String, Object> normalParams = new HashMap<String, Object>();
        List<String> hyperParamKeys = new ArrayList<String>();
        List<List> hyperParamValues = new ArrayList<List>();

        for(Entry<String, Object> entry: sortedMap.entrySet()) {
            if(entry.getValue() instanceof List) {
                List values = (List) entry.getValue();
                if(values.isEmpty()) {
                    throw new BinningException(BinningErrorCode.ERROR_GRID_SEARCH_CONFIG, "Search param "
                            + entry.getKey() + " has no value.");
                }
                this.hyperParamCount += 1;
                hyperParamKeys.add(entry.getKey());
                hyperParamValues.add(values);
                hyperParamCntList.add(values.size());
            } else {
                normalParams.put(entry.getKey(), entry.getValue());
            }
        }

        int flattenParamsCount = 1;
        for(Integer cnt: hyperParamCntList) {
            flattenParamsCount *= cnt;
        }
        for(int i = 0; i < flattenParamsCount; i++) {
            Map<String, Object> map = new HashMap<String, Object>();
            int amplifier = 1;
            for(int j = hyperParamCntList.size() - 1; j >= 0; j--) {
                int currParamCnt = hyperParamCntList.get(j);
                map.put(hyperParamKeys.get(j), hyperParamValues.get(j).get(i / amplifier % currParamCnt));
                amplifier *= currParamCnt;
            }
            map.putAll(normalParams);
            this.flattenParams.add(map);
        }
    }

    /**
     * Make sure the total number of flatten params does not exceed the configured threshold.
     */
    private void checkParamsThreshold() {
        int threshold = Environment.getInt(Constants.SCOREBIN_GRIDSEARCH_THRESHOLD,
                Constants.DEFAULT_GRIDSEARCH_THRESHOLD);

        if(this.flattenParams.size() > threshold) {
            LOG.info("Grid search number {} is over threshold {}, only evenly spread {} of them are kept.",
                    this.flattenParams.size(), threshold, threshold);
            List<Map<String, Object>> oldFlattenParams = this.flattenParams;
            this.flattenParams = new ArrayList<Map<String, Object>>(threshold);
            // fixed selection, not random, to return the same result if called twice
            int mod = oldFlattenParams.size() % threshold;
            int factor = oldFlattenParams.size() / threshold;
            for(int i = 0; i < threshold; i++) {
                if(i > (threshold - 1 - mod)) {
                    this.flattenParams.add(oldFlattenParams.get((factor + 1) * i - (threshold - mod)));
                } else {
                    this.flattenParams.add(oldFlattenParams.get(factor * i));
                }
            }
        }
    }

    private void validate() {
        for(Map<String, Object> params: this.flattenParams) {
            HyperParams.fromMap(params);
        }
    }

    @Override
    public List<HyperParams> propose(int nTrials) {
        int size = nTrials <= 0 ? this.flattenParams.size() : Math.min(nTrials, this.flattenParams.size());
        List<HyperParams> proposals = new ArrayList<HyperParams>(size);
        for(int i = 0; i < size; i++) {
            proposals.add(HyperParams.fromMap(this.flattenParams.get(i)));
        }
        return proposals;
    }

    public int hyperParamCount() {
        return this.hyperParamCount;
    }

    public boolean hasHyperParam() {
        return this.hyperParamCount > 0;
    }
}
