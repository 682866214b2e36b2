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

import ml.shifu.groupest.exception.GroupEstErrorCode;
import ml.shifu.groupest.exception.GroupEstException;

import org.apache.commons.lang.StringUtils;

/**
 * Summary statistic computed per group.
 */
public enum EstimateType {
    MEAN("mean"), MEDIAN("median");

    private final String name;

    private EstimateType(String name) {
        this.name = name;
    }

    /**
     * Parse 'mean' or 'median', ignoring case and surrounding blanks.
     * 
     * @throws GroupEstException
     *             with {@link GroupEstErrorCode#ERROR_INVALID_CONFIGURATION} for any other value
     */
    public static EstimateType of(String estimate) {
        if(StringUtils.isNotBlank(estimate)) {
            String trimmed = estimate.trim();
            for(EstimateType type: values()) {
                if(type.name.equalsIgnoreCase(trimmed)) {
                    return type;
                }
            }
        }
        throw new GroupEstException(GroupEstErrorCode.ERROR_INVALID_CONFIGURATION,
                "estimate must be 'mean' or 'median', but got '" + estimate + "'");
    }

    @Override
    public String toString() {
        return name;
    }
}
