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
package ml.shifu.scorebin.executor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;

import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class ExecutorManagerTest {

    private ExecutorManager<Integer> manager;

    @BeforeMethod
    public void setUp() {
        manager = new ExecutorManager<Integer>(3);
    }

    @AfterMethod
    public void tearDown() {
        manager.forceShutDown();
    }

    @Test
    public void testResultsInSubmitOrder() {
        List<Callable<Integer>> tasks = new ArrayList<Callable<Integer>>();
        for(int i = 0; i < 6; i++) {
            final int value = i;
            tasks.add(new Callable<Integer>() {
                @Override
                public Integer call() throws Exception {
                    // later tasks finish first
                    Thread.sleep(10L * (6 - value));
                    return value * value;
                }
            });
        }
        Assert.assertEquals(manager.submitTasksAndWaitResults(tasks), Arrays.asList(0, 1, 4, 9, 16, 25));
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testRuntimeExceptionPropagates() {
        List<Callable<Integer>> tasks = new ArrayList<Callable<Integer>>();
        tasks.add(new Callable<Integer>() {
            @Override
            public Integer call() {
                throw new IllegalStateException("broken task");
            }
        });
        manager.submitTasksAndWaitResults(tasks);
    }

    @Test
    public void testCheckedExceptionWrapped() {
        List<Callable<Integer>> tasks = new ArrayList<Callable<Integer>>();
        tasks.add(new Callable<Integer>() {
            @Override
            public Integer call() throws Exception {
                throw new IOException("disk gone");
            }
        });
        try {
            manager.submitTasksAndWaitResults(tasks);
            Assert.fail("checked exception should be wrapped");
        } catch (BinningException e) {
            Assert.assertEquals(e.getError(), BinningErrorCode.ERROR_SEARCH_EXECUTION);
        }
    }
}
