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
package ml.shifu.groupest.exception;

/**
 * Group estimator error code
 */
public enum GroupEstErrorCode {

    /*
     * Configuration error 400 ~ 500
     */
    ERROR_INVALID_CONFIGURATION(400, "Invalid estimator configuration"), ERROR_GROUPEST_CONFIG(401,
            "Errors happen when loading groupestconfig"),

    /*
     * Data validation 1151 - 1200
     */
    ERROR_SHAPE_MISMATCH(1151, "The training rows and the target vector have different lengths"),
    ERROR_SCHEMA_MISMATCH(1152, "The input columns do not match the columns used in fit"),

    /*
     * Model state 1201 - 1250
     */
    ERROR_NOT_FITTED(1201, "Model has not been fitted, call fit before predict");

    /**
     * code
     */
    private final int code;

    /**
     * description
     */
    private final String description;

    private GroupEstErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * description getter
     * 
     * @return description
     */
    public String getDescription() {
        return description;
    }

    /**
     * code getter
     * 
     * @return code
     */
    public int getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code + ": " + description;
    }

}
