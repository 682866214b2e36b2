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
import ml.shifu.groupest.container.LabeledRows;
import ml.shifu.groupest.container.PositionalRows;
import ml.shifu.groupest.container.PredictionResult;
import ml.shifu.groupest.container.Resolution;
import ml.shifu.groupest.exception.GroupEstErrorCode;
import ml.shifu.groupest.exception.GroupEstException;

import com.google.common.collect.ImmutableMap;

import org.easymock.EasyMock;
import org.slf4j.Logger;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class GroupEstimatorTest {

    private static LabeledRows cities(String... values) {
        Object[][] rows = new Object[values.length][];
        for(int i = 0; i < values.length; i++) {
            rows[i] = new Object[] { values[i] };
        }
        return LabeledRows.of(Arrays.asList("city"), rows);
    }

    private static LabeledRows cityStores() {
        return LabeledRows.of(Arrays.asList("city", "store"),
                new Object[] { "A", "s1" },
                new Object[] { "A", "s1" },
                new Object[] { "A", "s2" },
                new Object[] { "B", "s1" },
                new Object[] { "B", "s3" });
    }

    private static final double[] CITY_STORE_TARGET = { 10d, 20d, 30d, 5d, 7d };

    private static GroupEstimator quietEstimator(EstimateType type) {
        return new GroupEstimator(type, MissingGroupReporter.NONE);
    }

    @Test
    public void testMeanPerGroup() {
        MissingGroupReporter reporter = EasyMock.createMock(MissingGroupReporter.class);
        reporter.report(1);
        EasyMock.expectLastCall().once();
        EasyMock.replay(reporter);

        GroupEstimator estimator = new GroupEstimator(EstimateType.MEAN, reporter);
        Assert.assertSame(estimator.fit(cities("A", "A", "B"), new double[] { 10d, 20d, 5d }), estimator);

        Assert.assertEquals(estimator.getGroupLookup().size(), 2);
        Assert.assertEquals(estimator.getGroupLookup().get(GroupKey.of("A")), Double.valueOf(15.0d));
        Assert.assertEquals(estimator.getGroupLookup().get(GroupKey.of("B")), Double.valueOf(5.0d));

        double[] estimates = estimator.predict(cities("A", "C"));
        Assert.assertEquals(estimates.length, 2);
        Assert.assertEquals(estimates[0], 15.0d, 1e-9);
        Assert.assertTrue(Double.isNaN(estimates[1]));

        EasyMock.verify(reporter);
    }

    @Test
    public void testMedianPerGroup() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEDIAN);
        estimator.fit(cities("A", "A", "A", "B", "B", "B", "B"),
                new double[] { 3d, 1d, 100d, 4d, 1d, 2d, 10d });

        Assert.assertEquals(estimator.getGroupLookup().get(GroupKey.of("A")), Double.valueOf(3.0d));
        Assert.assertEquals(estimator.getGroupLookup().get(GroupKey.of("B")), Double.valueOf(3.0d));
    }

    @Test
    public void testEstimateByName() {
        Assert.assertEquals(new GroupEstimator("median").getEstimateType(), EstimateType.MEDIAN);
        Assert.assertEquals(new GroupEstimator("mean").getEstimateType(), EstimateType.MEAN);
    }

    @Test
    public void testInvalidEstimate() {
        try {
            new GroupEstimator("mode");
            Assert.fail("mode is not a supported estimate");
        } catch (GroupEstException e) {
            Assert.assertEquals(e.getError(), GroupEstErrorCode.ERROR_INVALID_CONFIGURATION);
        }
    }

    @Test
    public void testDefaultCategoryFallback() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(cityStores(), CITY_STORE_TARGET, "city");

        Assert.assertEquals(estimator.getDefaultCategory(), "city");
        Assert.assertEquals(estimator.getDefaultLookup(), ImmutableMap.<Object, Double> of("A", 20d, "B", 6d));

        PredictionResult result = estimator.predictWithDetails(LabeledRows.of(Arrays.asList("city", "store"),
                new Object[] { "A", "s1" },
                new Object[] { "A", "s3" },
                new Object[] { "B", "s2" },
                new Object[] { "C", "s1" }));

        Assert.assertEquals(result.size(), 4);
        Assert.assertEquals(result.getEstimate(0), 15d, 1e-9);
        Assert.assertEquals(result.getEstimate(1), 20d, 1e-9);
        Assert.assertEquals(result.getEstimate(2), 6d, 1e-9);
        Assert.assertTrue(Double.isNaN(result.getEstimate(3)));
        Assert.assertEquals(result.getResolutions(),
                Arrays.asList(Resolution.EXACT, Resolution.DEFAULT, Resolution.DEFAULT, Resolution.MISSING));
        Assert.assertEquals(result.getMissingCount(), 1);
    }

    @Test
    public void testExactMatchWinsOverDefault() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(cityStores(), CITY_STORE_TARGET, "city");

        PredictionResult result = estimator.predictWithDetails(LabeledRows.of(Arrays.asList("city", "store"),
                new Object[] { "A", "s2" }));
        Assert.assertEquals(result.getEstimate(0), 30d, 1e-9);
        Assert.assertEquals(result.getResolution(0), Resolution.EXACT);
    }

    @Test
    public void testNoDefaultMeansMissing() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(cityStores(), CITY_STORE_TARGET);

        Assert.assertNull(estimator.getDefaultCategory());
        Assert.assertNull(estimator.getDefaultLookup());
        PredictionResult result = estimator.predictWithDetails(LabeledRows.of(Arrays.asList("city", "store"),
                new Object[] { "A", "s3" }));
        Assert.assertTrue(Double.isNaN(result.getEstimate(0)));
        Assert.assertEquals(result.getMissingCount(), 1);
    }

    @Test
    public void testReorderedQueryColumns() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(cityStores(), CITY_STORE_TARGET, "city");

        double[] canonical = estimator.predict(LabeledRows.of(Arrays.asList("city", "store"),
                new Object[] { "A", "s1" }, new Object[] { "B", "s3" }, new Object[] { "B", "s9" }));
        double[] reordered = estimator.predict(LabeledRows.of(Arrays.asList("store", "city"),
                new Object[] { "s1", "A" }, new Object[] { "s3", "B" }, new Object[] { "s9", "B" }));

        Assert.assertEquals(reordered, canonical, 1e-9);
        Assert.assertEquals(reordered, new double[] { 15d, 7d, 6d }, 1e-9);
    }

    @Test
    public void testPositionalQuery() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(cityStores(), CITY_STORE_TARGET);

        double[] estimates = estimator.predict(PositionalRows.of(new Object[] { "A", "s1" },
                new Object[] { "B", "s1" }));
        Assert.assertEquals(estimates, new double[] { 15d, 5d }, 1e-9);
    }

    @Test
    public void testPositionalTraining() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(PositionalRows.of(new Object[] { 1, "x" }, new Object[] { 1, "x" }, new Object[] { 2, "y" }),
                new double[] { 1d, 3d, 10d }, "0");

        Assert.assertEquals(estimator.getColumns(), Arrays.asList("0", "1"));
        Assert.assertEquals(estimator.getGroupLookup().get(GroupKey.of(1, "x")), Double.valueOf(2d));
        Assert.assertEquals(estimator.predict(PositionalRows.of(new Object[] { 2, "z" })), new double[] { 10d },
                1e-9);
    }

    @Test(expectedExceptions = { GroupEstException.class })
    public void testPositionalQueryWrongWidth() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(cityStores(), CITY_STORE_TARGET);
        estimator.predict(PositionalRows.of(new Object[] { "A" }));
    }

    @Test
    public void testSchemaMismatch() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(cityStores(), CITY_STORE_TARGET);

        List<List<String>> badSchemas = Arrays.asList(Arrays.asList("city"),
                Arrays.asList("city", "store", "region"), Arrays.asList("city", "shop"));
        for(List<String> columns: badSchemas) {
            Object[] row = new Object[columns.size()];
            Arrays.fill(row, "A");
            try {
                estimator.predict(LabeledRows.of(columns, row));
                Assert.fail("Columns " + columns + " should not match");
            } catch (GroupEstException e) {
                Assert.assertEquals(e.getError(), GroupEstErrorCode.ERROR_SCHEMA_MISMATCH);
            }
        }
    }

    @Test
    public void testPredictBeforeFit() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        Assert.assertFalse(estimator.isFitted());
        try {
            estimator.predict(cities("A"));
            Assert.fail("predict before fit");
        } catch (GroupEstException e) {
            Assert.assertEquals(e.getError(), GroupEstErrorCode.ERROR_NOT_FITTED);
        }
    }

    @Test(expectedExceptions = { GroupEstException.class })
    public void testLookupBeforeFit() {
        quietEstimator(EstimateType.MEAN).getGroupLookup();
    }

    @Test
    public void testShapeMismatchKeepsPreviousModel() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(cities("A", "A", "B"), new double[] { 10d, 20d, 5d });
        Map<GroupKey, Double> before = estimator.getGroupLookup();

        try {
            estimator.fit(cities("X", "Y", "Z"), new double[] { 1d, 2d });
            Assert.fail("3 rows and 2 targets");
        } catch (GroupEstException e) {
            Assert.assertEquals(e.getError(), GroupEstErrorCode.ERROR_SHAPE_MISMATCH);
        }

        Assert.assertSame(estimator.getGroupLookup(), before);
        Assert.assertEquals(estimator.predict(cities("A")), new double[] { 15d }, 1e-9);
    }

    @Test
    public void testUnknownDefaultCategoryKeepsPreviousModel() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(cityStores(), CITY_STORE_TARGET, "city");

        try {
            estimator.fit(cityStores(), CITY_STORE_TARGET, "region");
            Assert.fail("region is not a column");
        } catch (GroupEstException e) {
            Assert.assertEquals(e.getError(), GroupEstErrorCode.ERROR_INVALID_CONFIGURATION);
        }
        Assert.assertEquals(estimator.getDefaultCategory(), "city");
    }

    @Test
    public void testRefitReplacesState() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(cityStores(), CITY_STORE_TARGET, "city");
        estimator.fit(cities("C"), new double[] { 1d });

        Assert.assertEquals(estimator.getColumns(), Arrays.asList("city"));
        Assert.assertEquals(estimator.getGroupLookup().keySet().size(), 1);
        Assert.assertNull(estimator.getDefaultLookup());
        Assert.assertTrue(Double.isNaN(estimator.predict(cities("A"))[0]));
    }

    @Test
    public void testMissingCategoriesAreNotGrouped() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(LabeledRows.of(Arrays.asList("city", "store"),
                new Object[] { "A", null },
                new Object[] { "A", "s1" },
                new Object[] { null, "s1" }), new double[] { 100d, 10d, 50d }, "city");

        Assert.assertEquals(estimator.getGroupLookup(), ImmutableMap.of(GroupKey.of("A", "s1"), 10d));
        // the row without a store still counts for its city
        Assert.assertEquals(estimator.getDefaultLookup(), ImmutableMap.<Object, Double> of("A", 55d));

        PredictionResult result = estimator.predictWithDetails(LabeledRows.of(Arrays.asList("city", "store"),
                new Object[] { "A", null }, new Object[] { null, "s1" }));
        Assert.assertEquals(result.getEstimate(0), 55d, 1e-9);
        Assert.assertEquals(result.getResolution(1), Resolution.MISSING);
    }

    @Test
    public void testNaNTargets() {
        GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(cities("A", "A", "B"), Arrays.asList(4d, Double.NaN, null));

        Assert.assertEquals(estimator.getGroupLookup().get(GroupKey.of("A")), Double.valueOf(4d));
        Assert.assertTrue(estimator.getGroupLookup().containsKey(GroupKey.of("B")));
        PredictionResult result = estimator.predictWithDetails(cities("B"));
        Assert.assertTrue(Double.isNaN(result.getEstimate(0)));
        Assert.assertEquals(result.getResolution(0), Resolution.EXACT);
        Assert.assertEquals(result.getMissingCount(), 0);
    }

    @Test
    public void testFromMapsRows() {
        List<Map<String, Object>> train = new ArrayList<Map<String, Object>>();
        for(Object[] pair: new Object[][] { { "A", 1 }, { "A", 1 }, { "B", 2 } }) {
            Map<String, Object> row = new LinkedHashMap<String, Object>();
            row.put("city", pair[0]);
            row.put("tier", pair[1]);
            train.add(row);
        }
        GroupEstimator estimator = quietEstimator(EstimateType.MEDIAN);
        estimator.fit(LabeledRows.fromMaps(train), new double[] { 1d, 2d, 9d });

        Assert.assertEquals(estimator.getColumns(), Arrays.asList("city", "tier"));
        Assert.assertEquals(estimator.getGroupLookup().get(GroupKey.of("A", 1)), Double.valueOf(1.5d));
        // Long 1 is not Integer 1
        Assert.assertNull(estimator.getGroupLookup().get(GroupKey.of("A", 1L)));
    }

    @Test
    public void testNoReportWhenNothingMissing() {
        MissingGroupReporter reporter = EasyMock.createMock(MissingGroupReporter.class);
        EasyMock.replay(reporter);

        GroupEstimator estimator = new GroupEstimator(EstimateType.MEAN, reporter);
        estimator.fit(cities("A", "B"), new double[] { 1d, 2d });
        Assert.assertEquals(estimator.predict(cities("B", "A", "B")), new double[] { 2d, 1d, 2d }, 1e-9);
        Assert.assertEquals(estimator.predict(cities()).length, 0);

        EasyMock.verify(reporter);
    }

    @Test
    public void testReportOncePerCall() {
        MissingGroupReporter reporter = EasyMock.createMock(MissingGroupReporter.class);
        reporter.report(3);
        EasyMock.expectLastCall().once();
        EasyMock.replay(reporter);

        GroupEstimator estimator = new GroupEstimator(EstimateType.MEAN, reporter);
        estimator.fit(cities("A"), new double[] { 1d });
        double[] estimates = estimator.predict(cities("X", "A", "Y", "Z"));
        Assert.assertEquals(estimates.length, 4);

        EasyMock.verify(reporter);
    }

    @Test
    public void testDefaultReporterLogsNotice() {
        Logger logger = EasyMock.createMock(Logger.class);
        logger.warn("2 missing groups were not present in the training data.");
        EasyMock.expectLastCall().once();
        EasyMock.replay(logger);

        GroupEstimator estimator = new GroupEstimator(EstimateType.MEAN, new LoggingMissingGroupReporter(logger));
        estimator.fit(cities("A"), new double[] { 1d });
        estimator.predict(cities("A", "B", "C"));

        EasyMock.verify(logger);
    }

    @Test
    public void testConcurrentPredict() throws Exception {
        final GroupEstimator estimator = quietEstimator(EstimateType.MEAN);
        estimator.fit(cityStores(), CITY_STORE_TARGET, "city");
        final LabeledRows query = LabeledRows.of(Arrays.asList("store", "city"),
                new Object[] { "s1", "A" }, new Object[] { "s9", "B" }, new Object[] { "s1", "Q" });

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<double[]>> futures = new ArrayList<Future<double[]>>();
            for(int i = 0; i < 16; i++) {
                futures.add(pool.submit(new Callable<double[]>() {
                    @Override
                    public double[] call() {
                        return estimator.predict(query);
                    }
                }));
            }
            for(Future<double[]> future: futures) {
                double[] estimates = future.get(10, TimeUnit.SECONDS);
                Assert.assertEquals(estimates[0], 15d, 1e-9);
                Assert.assertEquals(estimates[1], 6d, 1e-9);
                Assert.assertTrue(Double.isNaN(estimates[2]));
            }
        } finally {
            pool.shutdownNow();
        }
    }

}
