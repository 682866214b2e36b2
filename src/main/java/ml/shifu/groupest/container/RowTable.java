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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved rows: an ordered list of column names and the value rows, each as wide as the column list. This is
 * the single internal row form every {@link Rows} variant is turned into.
 */
public final class RowTable {

    private final List<String> columns;

    private final List<List<Object>> rows;

    RowTable(List<String> columns, List<List<Object>> rows) {
        this.columns = ImmutableList.copyOf(columns);
        this.rows = Collections.unmodifiableList(rows);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public int indexOf(String column) {
        return columns.indexOf(column);
    }

    /**
     * Project and reorder this table onto the given columns, all of which must exist here.
     */
    public RowTable select(List<String> selected) {
        if(selected.equals(columns)) {
            return this;
        }
        Map<String, Integer> positions = new HashMap<String, Integer>();
        for(int i = 0; i < columns.size(); i++) {
            positions.put(columns.get(i), i);
        }
        int[] index = new int[selected.size()];
        for(int i = 0; i < index.length; i++) {
            Integer pos = positions.get(selected.get(i));
            if(pos == null) {
                throw new IllegalArgumentException("Column " + selected.get(i) + " does not exist in " + columns);
            }
            index[i] = pos;
        }

        List<List<Object>> projected = new ArrayList<List<Object>>(rows.size());
        for(List<Object> row: rows) {
            Object[] values = new Object[index.length];
            for(int i = 0; i < index.length; i++) {
                values[i] = row.get(index[i]);
            }
            projected.add(Collections.unmodifiableList(Arrays.asList(values)));
        }
        return new RowTable(selected, projected);
    }

    static List<List<Object>> copyRows(List<? extends List<?>> source, int width) {
        List<List<Object>> copied = Lists.newArrayListWithCapacity(source.size());
        for(int i = 0; i < source.size(); i++) {
            List<?> row = source.get(i);
            if(row == null || row.size() != width) {
                throw new IllegalArgumentException("Row " + i + " has " + (row == null ? 0 : row.size())
                        + " values, expected " + width);
            }
            copied.add(Collections.unmodifiableList(Arrays.asList(row.toArray())));
        }
        return copied;
    }

}
