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

import org.testng.Assert;
import org.testng.annotations.Test;

public class EstimateTypeTest {

    @Test
    public void testParse() {
        Assert.assertEquals(EstimateType.of("mean"), EstimateType.MEAN);
        Assert.assertEquals(EstimateType.of(" Median "), EstimateType.MEDIAN);
        Assert.assertEquals(EstimateType.MEDIAN.toString(), "median");
    }

    @Test
    public void testInvalidValues() {
        for(String value: new String[] { null, "", "  ", "avg", "sum" }) {
            try {
                EstimateType.of(value);
                Assert.fail("'" + value + "' should be rejected");
            } catch (GroupEstException e) {
                Assert.assertEquals(e.getError(), GroupEstErrorCode.ERROR_INVALID_CONFIGURATION);
                Assert.assertEquals(e.getError().getCode(), 400);
            }
        }
    }

    @Test
    public void testMissingMessage() {
        Assert.assertEquals(LoggingMissingGroupReporter.formatMessage(1),
                "1 missing groups were not present in the training data.");
    }

}
