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

/**
 * Receives the number of query rows of one predict call for which neither the group table nor the default table
 * had an estimate. Only called when that number is greater than zero.
 */
public interface MissingGroupReporter {

    /**
     * Reporter which ignores the count.
     */
    MissingGroupReporter NONE = new MissingGroupReporter() {
        @Override
        public void report(int missingCount) {
        }
    };

    void report(int missingCount);

}
