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
package ml.shifu.groupest.core;

import ml.shifu.groupest.util.Constants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default reporter, writes "&lt;N&gt; missing groups were not present in the training data." to the log at WARN
 * level.
 */
public class LoggingMissingGroupReporter implements MissingGroupReporter {

    private final Logger log;

    public LoggingMissingGroupReporter() {
        this(LoggerFactory.getLogger(LoggingMissingGroupReporter.class));
    }

    public LoggingMissingGroupReporter(Logger log) {
        this.log = log;
    }

    @Override
    public void report(int missingCount) {
        log.warn(formatMessage(missingCount));
    }

    public static String formatMessage(int missingCount) {
        return String.format(Constants.MISSING_GROUPS_MESSAGE, missingCount);
    }

}
