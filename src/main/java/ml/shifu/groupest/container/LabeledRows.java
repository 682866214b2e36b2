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
import org.apache.commons.lang.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rows with named columns. Column names are unique and not blank, every row is exactly as wide as the column
 * list. Values are copied on construction so later changes to the caller's lists are not seen.
 */
public class LabeledRows extends Rows {

    private final RowTable table;

    public LabeledRows(List<String> columns, List<? extends List<?>> rows) {
        checkColumns(columns);
        this.table = new RowTable(columns, RowTable.copyRows(rows, columns.size()));
    }

    public static LabeledRows of(List<String> columns, Object[]... rows) {
        List<List<?>> list = Lists.newArrayListWithCapacity(rows.length);
        for(Object[] row: rows) {
            list.add(Arrays.asList(row));
        }
        return new LabeledRows(columns, list);
    }

    /**
     * Build rows from name to value maps. The column order is the iteration order of the first map; every map
     * must carry the same set of names.
     */
    public static LabeledRows fromMaps(List<? extends Map<String, ?>> maps) {
        if(maps == null || maps.isEmpty()) {
            throw new IllegalArgumentException("At least one row is needed to know the columns");
        }
        List<String> columns = new ArrayList<String>(maps.get(0).keySet());
        Set<String> columnSet = new HashSet<String>(columns);

        List<List<?>> rows = Lists.newArrayListWithCapacity(maps.size());
        for(int i = 0; i < maps.size(); i++) {
            Map<String, ?> map = maps.get(i);
            if(!columnSet.equals(map.keySet())) {
                throw new IllegalArgumentException("Row " + i + " has columns " + map.keySet() + ", expected "
                        + columns);
            }
            List<Object> row = new ArrayList<Object>(columns.size());
            for(String column: columns) {
                row.add(map.get(column));
            }
            rows.add(row);
        }
        return new LabeledRows(columns, rows);
    }

    public List<String> getColumns() {
        return table.getColumns();
    }

    @Override
    public int size() {
        return table.size();
    }

    @Override
    public RowTable toTable() {
        return table;
    }

    @Override
    public RowTable resolve(List<String> fittedColumns) {
        List<String> columns = table.getColumns();
        if(columns.equals(fittedColumns)) {
            return table;
        }
        if(columns.size() != fittedColumns.size()
                || !new HashSet<String>(columns).equals(new HashSet<String>(fittedColumns))) {
            return null;
        }
        return table.select(fittedColumns);
    }

    private static void checkColumns(List<String> columns) {
        if(columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Columns should not be empty");
        }
        Set<String> seen = new LinkedHashSet<String>();
        for(String column: columns) {
            if(StringUtils.isBlank(column)) {
                throw new IllegalArgumentException("Column name should not be blank: " + columns);
            }
            if(!seen.add(column)) {
                throw new IllegalArgumentException("Duplicate column name " + column + " in " + columns);
            }
        }
    }

}
