/*
 * Copyright [2012-2014] PayPal Software Foundation
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
package ml.shifu.groupest.util;

import ml.shifu.groupest.exception.GroupEstErrorCode;
import ml.shifu.groupest.exception.GroupEstException;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * {@link Environment} is used to store global settings like the default estimate kind and return them to user by
 * calling {@link #getProperty(String)} method.
 * 
 * <p>
 * Settings are loaded in order from ${GROUPEST_HOME}/conf/groupestconfig, /etc/groupestconfig and
 * ~/.groupestconfig; JVM system properties starting with 'groupest.' win over all files.
 */
public class Environment {

    private static Logger log = LoggerFactory.getLogger(Environment.class);

    private static Properties properties = new Properties();

    static {
        reload();
    }

    /**
     * Reload all settings.
     * 
     * @throws GroupEstException
     *             {@link GroupEstErrorCode#ERROR_GROUPEST_CONFIG} if an existing config file cannot be read or parsed
     */
    public static void reload() {
        try {
            loadGroupEstConfig();
        } catch (IOException e) {
            throw new GroupEstException(GroupEstErrorCode.ERROR_GROUPEST_CONFIG, e, e.getMessage());
        }
    }

    /**
     * Load properties from
     * ${GROUPEST_HOME}/conf/groupestconfig
     * /etc/groupestconfig
     * ~/.groupestconfig
     * and the 'groupest.' system properties. Provide function to reload.
     * 
     * @throws IOException
     *             if an existing config file cannot be read or is malformed
     */
    public static synchronized void loadGroupEstConfig() throws IOException {
        Properties loaded = new Properties();

        String home = System.getenv(Constants.GROUPEST_HOME);
        if(StringUtils.isBlank(home)) {
            home = System.getProperty(Constants.GROUPEST_HOME);
        }
        if(StringUtils.isNotBlank(home)) {
            loadProperties(loaded, home + File.separator + "conf" + File.separator + Constants.CONFIG_FILE_NAME);
        }

        loadProperties(loaded, File.separator + "etc" + File.separator + Constants.CONFIG_FILE_NAME);

        String userHome = System.getProperty("user.home");
        loadProperties(loaded, userHome + File.separator + "." + Constants.CONFIG_FILE_NAME);

        for(String name: System.getProperties().stringPropertyNames()) {
            if(name.startsWith(Constants.PROPERTY_PREFIX)) {
                loaded.setProperty(name, System.getProperty(name));
            }
        }

        properties = loaded;
    }

    /**
     * Get global property by property name
     */
    public static String getProperty(String propertyName) {
        return properties.getProperty(propertyName);
    }

    /**
     * Get property, if null return default value
     */
    public static String getProperty(String propertyName, String defValue) {
        String propertyValue = getProperty(propertyName);
        return (propertyValue == null) ? defValue : propertyValue;
    }

    public static void setProperty(String propertyName, String propertyValue) {
        properties.setProperty(propertyName, propertyValue);
    }

    public static void removeProperty(String propertyName) {
        properties.remove(propertyName);
    }

    /**
     * Get property as boolean value, if null or blank return default value
     */
    public static boolean getBoolean(String propertyName, boolean defValue) {
        String propertyValue = getProperty(propertyName);
        return StringUtils.isBlank(propertyValue) ? defValue : Boolean.parseBoolean(propertyValue.trim());
    }

    private static void loadProperties(Properties props, String fileName) throws IOException {
        File configFile = new File(fileName);
        if(!configFile.isFile()) {
            return;
        }

        InputStream is = null;
        try {
            is = new FileInputStream(configFile);
            props.load(is);
            log.debug("Loaded config file {}", fileName);
        } catch (IllegalArgumentException e) {
            // bad unicode escape
            throw new IOException("Malformed config file " + fileName, e);
        } finally {
            IOUtils.closeQuietly(is);
        }
    }

}
