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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Calculator, it folds target values into per group accumulators and then finalizes them into an immutable
 * lookup table of group to mean or median.
 * 
 * <p>
 * Phase one ({@link #add(Object, double)}) keeps a running sum and count for mean, or every value for median.
 * Phase two ({@link #finish()}) reduces each group. NaN targets are skipped; a group which only saw NaN targets
 * is kept with a NaN estimate.
 * 
 * @param <K>
 *            group key type
 */
public class GroupStatsCalculator<K> {

    private final EstimateType estimateType;

    private final Map<K, Accumulator> accumulators = Maps.newLinkedHashMap();

    public GroupStatsCalculator(EstimateType estimateType) {
        this.estimateType = estimateType;
    }

    public void add(K key, double target) {
        Accumulator accumulator = accumulators.get(key);
        if(accumulator == null) {
            accumulator = newAccumulator();
            accumulators.put(key, accumulator);
        }
        if(!Double.isNaN(target)) {
            accumulator.add(target);
        }
    }

    public int getGroupCount() {
        return accumulators.size();
    }

    public Map<K, Double> finish() {
        ImmutableMap.Builder<K, Double> builder = ImmutableMap.builder();
        for(Map.Entry<K, Accumulator> entry: accumulators.entrySet()) {
            builder.put(entry.getKey(), entry.getValue().finish());
        }
        return builder.build();
    }

    private Accumulator newAccumulator() {
        switch(estimateType) {
            case MEDIAN:
                return new MedianAccumulator();
            case MEAN:
            default:
                return new MeanAccumulator();
        }
    }

    /**
     * Arithmetic mean, NaN when the list is empty.
     */
    public static double mean(List<Double> values) {
        MeanAccumulator accumulator = new MeanAccumulator();
        for(Double value: values) {
            accumulator.add(value);
        }
        return accumulator.finish();
    }

    /**
     * Median with the two middle values averaged on even size, NaN when the list is empty.
     */
    public static double median(List<Double> values) {
        MedianAccumulator accumulator = new MedianAccumulator();
        for(Double value: values) {
            accumulator.add(value);
        }
        return accumulator.finish();
    }

    private interface Accumulator {

        void add(double value);

        double finish();
    }

    private static class MeanAccumulator implements Accumulator {

        private double sum = 0d;

        private long count = 0L;

        @Override
        public void add(double value) {
            sum += value;
            count++;
        }

        @Override
        public double finish() {
            return count == 0L ? Double.NaN : sum / count;
        }
    }

    private static class MedianAccumulator implements Accumulator {

        private final List<Double> values = new ArrayList<Double>();

        @Override
        public void add(double value) {
            values.add(value);
        }

        @Override
        public double finish() {
            int size = values.size();
            if(size == 0) {
                return Double.NaN;
            }
            List<Double> sorted = new ArrayList<Double>(values);
            Collections.sort(sorted);
            int middle = size / 2;
            if(size % 2 == 1) {
                return sorted.get(middle);
            }
            return (sorted.get(middle - 1) + sorted.get(middle)) / 2d;
        }
    }

}
