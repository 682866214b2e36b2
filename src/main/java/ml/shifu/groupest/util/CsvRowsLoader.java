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
package ml.shifu.groupest.util;

import ml.shifu.groupest.container.LabeledRows;
import ml.shifu.groupest.exception.GroupEstErrorCode;
import ml.shifu.groupest.exception.GroupEstException;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang.StringUtils;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Load a delimited text file with a header line into {@link LabeledRows}. Category values are kept as trimmed
 * strings, blank category cells are read as null (missing); blank lines are skipped.
 */
public class CsvRowsLoader {

    private final String delimiter;

    public CsvRowsLoader() {
        this(Environment.getProperty(Constants.CSV_DELIMITER, Constants.DEFAULT_DELIMITER));
    }

    public CsvRowsLoader(String delimiter) {
        if(StringUtils.isEmpty(delimiter)) {
            throw new IllegalArgumentException("Delimiter should not be empty");
        }
        this.delimiter = delimiter;
    }

    /**
     * Load all columns of the file.
     */
    public LabeledRows loadRows(File file) throws IOException {
        return loadRows(file, null);
    }

    /**
     * Load all columns except excludedColumn, which may be null or absent from the file.
     */
    public LabeledRows loadRows(File file, String excludedColumn) throws IOException {
        List<List<String>> lines = readLines(file);
        List<String> header = lines.get(0);
        int excluded = excludedColumn == null ? -1 : header.indexOf(excludedColumn);
        return toRows(lines, excluded);
    }

    /**
     * Load category columns and the numeric target column of a training file. Blank or invalid target cells are
     * read as NaN.
     * 
     * @throws GroupEstException
     *             {@link GroupEstErrorCode#ERROR_INVALID_CONFIGURATION} if the target column is not in the header
     */
    public TrainingData loadTrainingData(File file, String targetColumn) throws IOException {
        List<List<String>> lines = readLines(file);
        int targetIndex = lines.get(0).indexOf(targetColumn);
        if(targetIndex < 0) {
            throw new GroupEstException(GroupEstErrorCode.ERROR_INVALID_CONFIGURATION, "Target column '"
                    + targetColumn + "' is not found in header " + lines.get(0) + " of " + file);
        }

        double[] target = new double[lines.size() - 1];
        for(int i = 1; i < lines.size(); i++) {
            target[i - 1] = CommonUtils.parseDouble(lines.get(i).get(targetIndex));
        }
        return new TrainingData(toRows(lines, targetIndex), target);
    }

    private List<List<String>> readLines(File file) throws IOException {
        Splitter splitter = Splitter.on(delimiter).trimResults();
        List<List<String>> lines = new ArrayList<List<String>>();
        int lineNumber = 0;
        for(String line: FileUtils.readLines(file, "UTF-8")) {
            lineNumber++;
            if(StringUtils.isBlank(line)) {
                continue;
            }
            List<String> fields = Lists.newArrayList(splitter.split(line));
            if(!lines.isEmpty() && fields.size() != lines.get(0).size()) {
                throw new IllegalArgumentException("Line " + lineNumber + " of " + file + " has " + fields.size()
                        + " fields, expected " + lines.get(0).size());
            }
            lines.add(fields);
        }
        if(lines.isEmpty()) {
            throw new IllegalArgumentException("No header is found in " + file);
        }
        return lines;
    }

    private static LabeledRows toRows(List<List<String>> lines, int excluded) {
        List<String> header = new ArrayList<String>(lines.get(0));
        if(excluded >= 0) {
            header.remove(excluded);
        }

        List<List<String>> rows = new ArrayList<List<String>>(lines.size() - 1);
        for(List<String> fields: lines.subList(1, lines.size())) {
            List<String> row = new ArrayList<String>(header.size());
            for(int i = 0; i < fields.size(); i++) {
                if(i != excluded) {
                    // blank cell is a missing category
                    row.add(StringUtils.isEmpty(fields.get(i)) ? null : fields.get(i));
                }
            }
            rows.add(row);
        }
        return new LabeledRows(header, rows);
    }

    /**
     * Category rows with their aligned target values.
     */
    public static class TrainingData {

        private final LabeledRows rows;

        private final double[] target;

        public TrainingData(LabeledRows rows, double[] target) {
            this.rows = rows;
            this.target = target;
        }

        public LabeledRows getRows() {
            return rows;
        }

        public double[] getTarget() {
            return target;
        }
    }

}
