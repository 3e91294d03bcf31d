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
 * BinningException, contain error code. Sub classes are used for the failures a search is allowed to recover from.
 */
public class BinningException extends RuntimeException {

    private static final long serialVersionUID = -4461382735907140117L;

    /**
     * error code
     */
    private final BinningErrorCode error;

    public BinningException(BinningErrorCode code) {
        super(code.getDescription());
        this.error = code;
    }

    public BinningException(BinningErrorCode code, Exception e) {
        super(e);
        this.error = code;
    }

    public BinningException(BinningErrorCode code, String msg) {
        super(msg);
        this.error = code;
    }

    public BinningException(BinningErrorCode code, Exception e, String msg) {
        super(msg, e);
        this.error = code;
    }

    public BinningErrorCode getError() {
        return error;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " [error=" + error + ", message=" + getMessage() + "]";
    }

}
