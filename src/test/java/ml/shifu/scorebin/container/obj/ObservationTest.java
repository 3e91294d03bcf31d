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
package ml.shifu.scorebin.container.obj;

import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ObservationTest {

    @Test
    public void testNumeric() {
        Observation observation = Observation.numeric(1.5d, 1, "201801");
        Assert.assertFalse(observation.isCategorical());
        Assert.assertTrue(observation.isEvent());
        Assert.assertEquals(observation.getNumericValue(), 1.5d);
        Assert.assertEquals(observation.getCohortId(), "201801");
    }

    @Test
    public void testCategorical() {
        Observation observation = Observation.categorical("CA", 0, "201802");
        Assert.assertTrue(observation.isCategorical());
        Assert.assertFalse(observation.isEvent());
        Assert.assertEquals(observation.getCategoricalValue(), "CA");
    }

    @Test
    public void testInvalidLabel() {
        try {
            Observation.numeric(1d, 2, "201801");
            Assert.fail("label 2 should be rejected");
        } catch (BinningException e) {
            Assert.assertEquals(e.getError(), BinningErrorCode.ERROR_INVALID_OBSERVATION);
        }
    }

    @Test(expectedExceptions = BinningException.class)
    public void testNaNValue() {
        Observation.numeric(Double.NaN, 0, "201801");
    }

    @Test(expectedExceptions = BinningException.class)
    public void testInfiniteValue() {
        Observation.numeric(Double.POSITIVE_INFINITY, 0, "201801");
    }

    @Test(expectedExceptions = BinningException.class)
    public void testNullCategory() {
        Observation.categorical(null, 0, "201801");
    }

    @Test(expectedExceptions = BinningException.class)
    public void testBlankCohort() {
        Observation.numeric(1d, 0, " ");
    }
}
