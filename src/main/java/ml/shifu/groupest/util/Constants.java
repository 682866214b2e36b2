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

/**
 * Global constants class
 */
public interface Constants {

    public static final String GROUPEST_HOME = "GROUPEST_HOME";

    public static final String CONFIG_FILE_NAME = "groupestconfig";

    /**
     * prefix of system properties which override the config files
     */
    public static final String PROPERTY_PREFIX = "groupest.";

    public static final String ESTIMATE = "groupest.estimate";

    public static final String REPORT_MISSING = "groupest.report.missing";

    public static final String CSV_DELIMITER = "groupest.csv.delimiter";

    public static final String DEFAULT_ESTIMATE = "mean";

    public static final String DEFAULT_DELIMITER = ",";

    public static final String MISSING_GROUPS_MESSAGE = "%d missing groups were not present in the training data.";

}
