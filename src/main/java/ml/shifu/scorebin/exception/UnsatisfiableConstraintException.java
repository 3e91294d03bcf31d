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
 * Raised when hard binning constraints contradict each other, the message names the failing constraint.
 */
public class UnsatisfiableConstraintException extends BinningException {

    private static final long serialVersionUID = 5826157039962154443L;

    public UnsatisfiableConstraintException(String msg) {
        super(BinningErrorCode.ERROR_UNSATISFIABLE_CONSTRAINT, msg);
    }

}
