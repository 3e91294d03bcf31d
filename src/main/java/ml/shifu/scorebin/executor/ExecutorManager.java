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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed size thread pool running search trials.
 */
public class ExecutorManager<T> {

    private static Logger LOG = LoggerFactory.getLogger(ExecutorManager.class);

    private ExecutorService executorService = null;

    public ExecutorManager(int threadPoolSize) {
        this.executorService = Executors.newFixedThreadPool(Math.max(1, threadPoolSize));
    }

    /**
     * Submit all tasks and wait for their results in submission order.
     * 
     * @throws BinningException
     *             with {@link BinningErrorCode#ERROR_SEARCH_EXECUTION} if a task throws a checked exception or the
     *             waiting thread is interrupted; runtime exceptions of tasks are re-thrown as they are
     */
    public List<T> submitTasksAndWaitResults(List<Callable<T>> tasks) {
        List<T> results = new ArrayList<T>(tasks.size());

        List<Future<T>> futureList = new ArrayList<Future<T>>(tasks.size());
        for(Callable<T> task: tasks) {
            futureList.add(executorService.submit(task));
        }

        for(Future<T> future: futureList) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BinningException(BinningErrorCode.ERROR_SEARCH_EXECUTION, e,
                        "Interrupted when waiting task to finish.");
            } catch (ExecutionException e) {
                LOG.error("Error occurred, when waiting task to finish.", e.getCause());
                if(e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw new BinningException(BinningErrorCode.ERROR_SEARCH_EXECUTION, e,
                        "Task failed: " + e.getCause());
            }
        }

        return results;
    }

    public void graceShutDown() {
        this.executorService.shutdown();
        try {
            this.executorService.awaitTermination(Integer.MAX_VALUE, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            LOG.error("Error occurred, when waiting task to finish.", e);
            Thread.currentThread().interrupt();
        }
    }

    public void forceShutDown() {
        this.executorService.shutdownNow();
        try {
            this.executorService.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
