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

import com.google.common.collect.Lists;

import java.util.Arrays;
import java.util.List;

/**
 * Rows without column names. At predict time they take the fitted column order as is; when used for fitting the
 * columns are named by position ("0", "1", ...).
 */
public class PositionalRows extends Rows {

    private final int width;

    private final List<List<Object>> rows;

    public PositionalRows(List<? extends List<?>> rows) {
        if(rows == null) {
            throw new IllegalArgumentException("Rows should not be null");
        }
        this.width = rows.isEmpty() || rows.get(0) == null ? 0 : rows.get(0).size();
        this.rows = RowTable.copyRows(rows, width);
    }

    public static PositionalRows of(Object[]... rows) {
        List<List<?>> list = Lists.newArrayListWithCapacity(rows.length);
        for(Object[] row: rows) {
            list.add(Arrays.asList(row));
        }
        return new PositionalRows(list);
    }

    /**
     * Number of values per row, 0 if there are no rows.
     */
    public int getWidth() {
        return width;
    }

    @Override
    public int size() {
        return rows.size();
    }

    @Override
    public RowTable toTable() {
        if(width == 0) {
            throw new IllegalArgumentException("Positional rows without any column cannot be used for fitting");
        }
        List<String> columns = Lists.newArrayListWithCapacity(width);
        for(int i = 0; i < width; i++) {
            columns.add(Integer.toString(i));
        }
        return new RowTable(columns, rows);
    }

    @Override
    public RowTable resolve(List<String> fittedColumns) {
        if(rows.isEmpty()) {
            return new RowTable(fittedColumns, rows);
        }
        if(width != fittedColumns.size()) {
            return null;
        }
        return new RowTable(fittedColumns, rows);
    }

}
