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

import java.util.List;

/**
 * Static helpers shared by the estimator and the loaders.
 */
public final class CommonUtils {

    private CommonUtils() {
    }

    /**
     * A category value is missing if it is null or a floating point NaN; such values never form a group.
     */
    public static boolean isMissingCategory(Object value) {
        if(value == null) {
            return true;
        }
        if(value instanceof Double) {
            return ((Double) value).isNaN();
        }
        if(value instanceof Float) {
            return ((Float) value).isNaN();
        }
        return false;
    }

    public static boolean hasMissingCategory(List<?> values) {
        for(Object value: values) {
            if(isMissingCategory(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Copy numbers into a primitive array, null entries become NaN.
     */
    public static double[] toDoubleArray(List<? extends Number> values) {
        if(values == null) {
            return null;
        }
        double[] result = new double[values.size()];
        for(int i = 0; i < result.length; i++) {
            Number n = values.get(i);
            result[i] = (n == null) ? Double.NaN : n.doubleValue();
        }
        return result;
    }

    /**
     * Parse a raw cell into a double, blank or invalid text becomes NaN.
     */
    public static double parseDouble(String raw) {
        if(raw == null) {
            return Double.NaN;
        }
        String trimmed = raw.trim();
        if(trimmed.isEmpty()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

}
