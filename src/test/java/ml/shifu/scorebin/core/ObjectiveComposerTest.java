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

import ml.shifu.scorebin.container.obj.ObjectiveWeights;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ObjectiveComposerTest {

    @Test
    public void testDefaultWeights() {
        Assert.assertEquals(ObjectiveComposer.compose(0.5d, 0.2d, 0.3d, 10d, ObjectiveWeights.DEFAULT),
                0.7d * 0.5d + 0.2d * 0.2d + 0.1d * 0.3d, 1e-12);
    }

    @Test
    public void testPsiWeight() {
        ObjectiveWeights weights = new ObjectiveWeights(0.7d, 0.2d, 0.1d, 1d);
        Assert.assertEquals(ObjectiveComposer.compose(0.5d, 0.2d, 0.3d, 0.1d, weights), 0.32d, 1e-12);
    }
}
