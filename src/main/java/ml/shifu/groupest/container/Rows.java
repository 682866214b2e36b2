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

import java.util.List;

/**
 * Input rows of the estimator. There are two variants:
 * <ul>
 * <li>{@link LabeledRows}: rows with column names, reordered by name against the fitted columns;</li>
 * <li>{@link PositionalRows}: rows without names, assumed to follow the fitted column order.</li>
 * </ul>
 * Both are resolved once at the API boundary into a {@link RowTable}.
 */
public abstract class Rows {

    /**
     * Number of rows.
     */
    public abstract int size();

    /**
     * Resolve rows for fitting, where the columns found here become the authoritative column order.
     */
    public abstract RowTable toTable();

    /**
     * Resolve rows for prediction against the fitted column order.
     * 
     * @return rows laid out in exactly the fitted column order, or null if the columns are not a reorderable
     *         match of the fitted ones
     */
    public abstract RowTable resolve(List<String> fittedColumns);

}
