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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.Properties;

import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Environment} holds process-wide knobs like search parallelism and grid search threshold. They are read
 * by the search driver only; refinement and scoring take an explicit {@code BinningConfig} instead.
 */
public class Environment {

    public static final String SCOREBIN_HOME = "SCOREBIN_HOME";

    private static Logger logger = LoggerFactory.getLogger(Environment.class);
    private static Properties properties = new Properties();

    static {
        String homePath = ((System.getenv(SCOREBIN_HOME) == null) ? System.getProperty(SCOREBIN_HOME) : System
                .getenv(SCOREBIN_HOME));
        properties.put(SCOREBIN_HOME, ((homePath == null) ? "" : homePath));

        try {
            loadScorebinConfig();
        } catch (IOException e) {
            throw new BinningException(BinningErrorCode.ERROR_SCOREBIN_CONFIG, e);
        }

        if(properties.size() == 1) {
            logger.debug("No scorebinconfig is found or there is no content in it");
        }
    }

    /*
     * Load properties from
     * 1. ${SCOREBIN_HOME}/conf/scorebinconfig
     * 2. /etc/scorebinconfig
     * 3. ~/.scorebinconfig
     */
    public static void loadScorebinConfig() throws IOException {
        loadProperties(properties, getProperty(SCOREBIN_HOME) + File.separator + "conf" + File.separator
                + "scorebinconfig");

        loadProperties(properties, File.separator + "etc" + File.separator + "scorebinconfig");

        String userHome = System.getProperty("user.home");
        loadProperties(properties, userHome + File.separator + ".scorebinconfig");
    }

    public static String getProperty(String propertyName) {
        return properties.getProperty(propertyName);
    }

    public static void setProperty(String propertyName, String propertyValue) {
        properties.put(propertyName, propertyValue);
    }

    public static void removeProperty(String propertyName) {
        properties.remove(propertyName);
    }

    public static String getProperty(String propertyName, String defValue) {
        String propertyValue = getProperty(propertyName);
        return (propertyValue == null) ? defValue : propertyValue;
    }

    public static Integer getInt(String propertyName, Integer defValue) {
        String propertyValue = getProperty(propertyName);
        return StringUtils.isBlank(propertyValue) ? defValue : Integer.valueOf(propertyValue.trim());
    }

    public static Double getDouble(String propertyName, Double defValue) {
        String propertyValue = getProperty(propertyName);
        return StringUtils.isBlank(propertyValue) ? defValue : Double.valueOf(propertyValue.trim());
    }

    public static Boolean getBoolean(String propertyName, Boolean defValue) {
        String propertyValue = getProperty(propertyName);
        return StringUtils.isBlank(propertyValue) ? defValue : Boolean.valueOf(propertyValue.trim());
    }

    private static void loadProperties(Properties props, String fileName) throws IOException {
        File configFile = new File(fileName);
        if(!configFile.exists()) {
            return;
        }

        logger.info("Loading scorebin config from {}", fileName);
        FileInputStream inStream = null;
        try {
            inStream = new FileInputStream(configFile);
            props.load(inStream);
        } finally {
            IOUtils.closeQuietly(inStream);
        }
    }

}
