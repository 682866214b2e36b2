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
package ml.shifu.groupest.container;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Estimates of one predict call, in query row order, with the lookup which resolved each row and the number of
 * rows nothing could be found for.
 */
public class PredictionResult {

    private final double[] estimates;

    private final List<Resolution> resolutions;

    private final int missingCount;

    public PredictionResult(double[] estimates, List<Resolution> resolutions) {
        if(estimates.length != resolutions.size()) {
            throw new IllegalArgumentException("Estimates and resolutions should have the same size");
        }
        this.estimates = estimates;
        this.resolutions = Collections.unmodifiableList(resolutions);
        int missing = 0;
        for(Resolution resolution: resolutions) {
            if(resolution == Resolution.MISSING) {
                missing++;
            }
        }
        this.missingCount = missing;
    }

    /**
     * @return a copy of the estimates, NaN where the row is missing
     */
    public double[] getEstimates() {
        return Arrays.copyOf(estimates, estimates.length);
    }

    public double getEstimate(int row) {
        return estimates[row];
    }

    public Resolution getResolution(int row) {
        return resolutions.get(row);
    }

    public List<Resolution> getResolutions() {
        return resolutions;
    }

    public int getMissingCount() {
        return missingCount;
    }

    public int size() {
        return estimates.length;
    }

    @Override
    public String toString() {
        return "PredictionResult [size=" + estimates.length + ", missingCount=" + missingCount + "]";
    }

}
