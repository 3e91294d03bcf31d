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
package ml.shifu.scorebin.util;

import java.io.IOException;
import java.io.InputStream;

import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.core.search.SearchSpace;
import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link JSONUtils} is a unified entry for all json format serialization and de-serialization.
 *
 * <p>
 * ObjectMapper instance is stored into ThreadLocal object to make sure thread safety.
 */
public class JSONUtils {

    private static final ThreadLocal<ObjectMapper> jsonMapper = new ThreadLocal<ObjectMapper>() {
        @Override
        protected ObjectMapper initialValue() {
            return new ObjectMapper();
        }
    };

    private static ObjectMapper getObjectMapperInstance() {
        return jsonMapper.get();
    }

    /*
     * @see ObjectMapper#readValue(InputStream, Class);
     */
    public static <T> T readValue(InputStream src, Class<T> valueType) throws IOException {
        return getObjectMapperInstance().readValue(src, valueType);
    }

    /**
     * @see ObjectMapper#writeValueAsString(Object)
     * @param value
     *            the object to serialize
     * @return pretty printed json string
     * @throws JsonProcessingException
     *             if the value can not be serialized
     */
    public static String writeValueAsString(Object value) throws JsonProcessingException {
        return getObjectMapperInstance().writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    /**
     * Load {@link BinningConfig} from a json stream, wrapping parse failures with
     * {@link BinningErrorCode#ERROR_LOAD_BINNING_CONFIG}.
     *
     * @param src
     *            json stream
     * @return the validated config
     */
    public static BinningConfig loadBinningConfig(InputStream src) {
        try {
            return readValue(src, BinningConfig.class);
        } catch (IOException e) {
            throw wrap(e, "Could not load binning config: ");
        }
    }

    public static SearchSpace loadSearchSpace(InputStream src) {
        try {
            return readValue(src, SearchSpace.class);
        } catch (IOException e) {
            throw wrap(e, "Could not load search space: ");
        }
    }

    /**
     * Validation failures thrown from json creators are re-thrown as they are, with their own error code.
     */
    private static BinningException wrap(IOException e, String prefix) {
        if(e.getCause() instanceof BinningException) {
            return (BinningException) e.getCause();
        }
        return new BinningException(BinningErrorCode.ERROR_LOAD_BINNING_CONFIG, e, prefix + e.getMessage());
    }

}
