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
package ml.shifu.scorebin.exception;

/**
 * Raised when stability is requested but the observations do not span at least two cohorts.
 */
public class EmptyCohortException extends BinningException {

    private static final long serialVersionUID = 2118604871305522911L;

    public EmptyCohortException(String msg) {
        super(BinningErrorCode.ERROR_EMPTY_COHORT, msg);
    }

}
