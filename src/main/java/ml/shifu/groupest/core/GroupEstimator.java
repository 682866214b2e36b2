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

import ml.shifu.groupest.container.GroupKey;
import ml.shifu.groupest.container.PredictionResult;
import ml.shifu.groupest.container.Resolution;
import ml.shifu.groupest.container.RowTable;
import ml.shifu.groupest.container.Rows;
import ml.shifu.groupest.exception.GroupEstErrorCode;
import ml.shifu.groupest.exception.GroupEstException;
import ml.shifu.groupest.util.CommonUtils;
import ml.shifu.groupest.util.Constants;
import ml.shifu.groupest.util.Environment;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * {@link GroupEstimator} learns the mean or median of a numeric target for every combination of categorical
 * values seen in training, and estimates new rows by looking their combination up.
 * 
 * <p>
 * Resolution of a query row, in priority order:
 * <ol>
 * <li>the full group key is in the group table: that estimate;</li>
 * <li>a default column was given in {@link #fit(Rows, double[], String)} and the row's value of it is in the
 * default table: the coarser single column estimate;</li>
 * <li>NaN, and the row counts as a missing group.</li>
 * </ol>
 * 
 * <p>
 * Thread safety: single writer, multiple readers. {@link #fit} must not run concurrently with itself or with
 * {@link #predict}; once fitting is done, any number of threads may call {@link #predict} at the same time since
 * prediction never writes estimator state. There is no internal locking. A fitted model is published as one
 * immutable snapshot, so a failed {@link #fit} leaves the previous model untouched.
 */
public class GroupEstimator {

    private static Logger log = LoggerFactory.getLogger(GroupEstimator.class);

    private final EstimateType estimateType;

    private final MissingGroupReporter reporter;

    private volatile FittedModel model;

    /**
     * Estimate kind from the 'groupest.estimate' setting, 'mean' if not set.
     */
    public GroupEstimator() {
        this(Environment.getProperty(Constants.ESTIMATE, Constants.DEFAULT_ESTIMATE));
    }

    public GroupEstimator(String estimate) {
        this(EstimateType.of(estimate));
    }

    public GroupEstimator(EstimateType estimateType) {
        this(estimateType, defaultReporter());
    }

    public GroupEstimator(EstimateType estimateType, MissingGroupReporter reporter) {
        if(estimateType == null) {
            throw new GroupEstException(GroupEstErrorCode.ERROR_INVALID_CONFIGURATION,
                    "estimate must be 'mean' or 'median'");
        }
        if(reporter == null) {
            throw new IllegalArgumentException("reporter should not be null, use MissingGroupReporter.NONE");
        }
        this.estimateType = estimateType;
        this.reporter = reporter;
    }

    public GroupEstimator fit(Rows trainingRows, double[] target) {
        return fit(trainingRows, target, null);
    }

    public GroupEstimator fit(Rows trainingRows, List<? extends Number> target) {
        return fit(trainingRows, CommonUtils.toDoubleArray(target), null);
    }

    public GroupEstimator fit(Rows trainingRows, List<? extends Number> target, String defaultCategory) {
        return fit(trainingRows, CommonUtils.toDoubleArray(target), defaultCategory);
    }

    /**
     * Build the group table, and the default table if defaultCategory is given. All previous state is replaced.
     * 
     * @param trainingRows
     *            categorical rows, their column order becomes the order of every group key
     * @param target
     *            one value per training row, aligned by position
     * @param defaultCategory
     *            optional column to index on its own for fallback, null for none
     * @return this estimator
     * @throws GroupEstException
     *             {@link GroupEstErrorCode#ERROR_SHAPE_MISMATCH} if row and target counts differ,
     *             {@link GroupEstErrorCode#ERROR_INVALID_CONFIGURATION} if defaultCategory is not a column
     */
    public GroupEstimator fit(Rows trainingRows, double[] target, String defaultCategory) {
        if(trainingRows == null) {
            throw new IllegalArgumentException("Training rows should not be null");
        }
        if(target == null) {
            throw new IllegalArgumentException("Target should not be null");
        }

        RowTable table = trainingRows.toTable();
        if(table.size() != target.length) {
            throw new GroupEstException(GroupEstErrorCode.ERROR_SHAPE_MISMATCH, "Training rows (" + table.size()
                    + ") and target (" + target.length + ") must have the same length");
        }

        int defaultIndex = -1;
        if(defaultCategory != null) {
            defaultIndex = table.indexOf(defaultCategory);
            if(defaultIndex < 0) {
                throw new GroupEstException(GroupEstErrorCode.ERROR_INVALID_CONFIGURATION, "default category '"
                        + defaultCategory + "' must be one of the columns " + table.getColumns());
            }
        }

        GroupStatsCalculator<GroupKey> groupCalculator = new GroupStatsCalculator<GroupKey>(estimateType);
        GroupStatsCalculator<Object> defaultCalculator = defaultIndex < 0 ? null
                : new GroupStatsCalculator<Object>(estimateType);

        List<List<Object>> rows = table.getRows();
        for(int i = 0; i < rows.size(); i++) {
            List<Object> row = rows.get(i);
            if(!CommonUtils.hasMissingCategory(row)) {
                groupCalculator.add(GroupKey.of(row), target[i]);
            }
            if(defaultCalculator != null) {
                Object value = row.get(defaultIndex);
                if(!CommonUtils.isMissingCategory(value)) {
                    defaultCalculator.add(value, target[i]);
                }
            }
        }

        this.model = new FittedModel(table.getColumns(), groupCalculator.finish(), defaultCategory, defaultIndex,
                defaultCalculator == null ? null : defaultCalculator.finish());

        log.debug("Fitted {} estimator on {} rows: {} groups over columns {}, default category {}", estimateType,
                rows.size(), groupCalculator.getGroupCount(), table.getColumns(), defaultCategory);
        return this;
    }

    /**
     * Estimate every query row, NaN for rows no table knows. The missing count goes to the reporter.
     * 
     * @return one estimate per query row, in query row order
     * @throws GroupEstException
     *             {@link GroupEstErrorCode#ERROR_NOT_FITTED} before a successful fit,
     *             {@link GroupEstErrorCode#ERROR_SCHEMA_MISMATCH} if the query columns cannot be matched
     */
    public double[] predict(Rows query) {
        return predictWithDetails(query).getEstimates();
    }

    /**
     * Same as {@link #predict(Rows)} but also tells which table resolved each row and how many rows are missing.
     */
    public PredictionResult predictWithDetails(Rows query) {
        FittedModel current = this.model;
        if(current == null) {
            throw new GroupEstException(GroupEstErrorCode.ERROR_NOT_FITTED);
        }
        if(query == null) {
            throw new IllegalArgumentException("Query rows should not be null");
        }

        RowTable table = query.resolve(current.columns);
        if(table == null) {
            throw new GroupEstException(GroupEstErrorCode.ERROR_SCHEMA_MISMATCH,
                    "Predict input columns must match the columns used in fit " + current.columns);
        }

        List<List<Object>> rows = table.getRows();
        double[] estimates = new double[rows.size()];
        List<Resolution> resolutions = Lists.newArrayListWithCapacity(rows.size());
        for(int i = 0; i < rows.size(); i++) {
            List<Object> row = rows.get(i);

            Double estimate = current.groupLookup.get(GroupKey.of(row));
            if(estimate != null) {
                estimates[i] = estimate;
                resolutions.add(Resolution.EXACT);
                continue;
            }

            if(current.defaultLookup != null) {
                Object value = row.get(current.defaultIndex);
                estimate = value == null ? null : current.defaultLookup.get(value);
                if(estimate != null) {
                    estimates[i] = estimate;
                    resolutions.add(Resolution.DEFAULT);
                    continue;
                }
            }

            estimates[i] = Double.NaN;
            resolutions.add(Resolution.MISSING);
        }

        PredictionResult result = new PredictionResult(estimates, resolutions);
        if(result.getMissingCount() > 0) {
            reporter.report(result.getMissingCount());
        }
        return result;
    }

    public boolean isFitted() {
        return model != null;
    }

    public EstimateType getEstimateType() {
        return estimateType;
    }

    public MissingGroupReporter getReporter() {
        return reporter;
    }

    /**
     * @return fitted column order
     */
    public List<String> getColumns() {
        return fitted().columns;
    }

    /**
     * @return immutable group key to estimate table
     */
    public Map<GroupKey, Double> getGroupLookup() {
        return fitted().groupLookup;
    }

    /**
     * @return default column name, null if fitted without one
     */
    public String getDefaultCategory() {
        return fitted().defaultCategory;
    }

    /**
     * @return immutable default column value to estimate table, null if fitted without a default column
     */
    public Map<Object, Double> getDefaultLookup() {
        return fitted().defaultLookup;
    }

    private FittedModel fitted() {
        FittedModel current = this.model;
        if(current == null) {
            throw new GroupEstException(GroupEstErrorCode.ERROR_NOT_FITTED);
        }
        return current;
    }

    private static MissingGroupReporter defaultReporter() {
        return Environment.getBoolean(Constants.REPORT_MISSING, true) ? new LoggingMissingGroupReporter()
                : MissingGroupReporter.NONE;
    }

    @Override
    public String toString() {
        FittedModel current = this.model;
        return "GroupEstimator [estimate=" + estimateType + ", fitted=" + (current != null)
                + (current == null ? "" : ", columns=" + current.columns + ", groups=" + current.groupLookup.size())
                + "]";
    }

    /**
     * Everything one fit produces, never changed afterwards.
     */
    private static final class FittedModel {

        private final List<String> columns;

        private final Map<GroupKey, Double> groupLookup;

        private final String defaultCategory;

        private final int defaultIndex;

        private final Map<Object, Double> defaultLookup;

        private FittedModel(List<String> columns, Map<GroupKey, Double> groupLookup, String defaultCategory,
                int defaultIndex, Map<Object, Double> defaultLookup) {
            this.columns = ImmutableList.copyOf(columns);
            this.groupLookup = groupLookup;
            this.defaultCategory = defaultCategory;
            this.defaultIndex = defaultIndex;
            this.defaultLookup = defaultLookup;
        }
    }

}
