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
package ml.shifu.groupest;

import ml.shifu.groupest.core.EstimateType;
import ml.shifu.groupest.core.GroupEstimator;
import ml.shifu.groupest.exception.GroupEstException;
import ml.shifu.groupest.util.CsvRowsLoader;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;

/**
 * Command line entry: fit a {@link GroupEstimator} on a training csv file and print one estimate per row of a
 * query csv file.
 * 
 * <pre>
 * GroupEstCLI -train train.csv -target y -query query.csv [-estimate median] [-default city] [-delimiter ,]
 * </pre>
 */
public class GroupEstCLI {

    private static final String TRAIN = "train";
    private static final String TARGET = "target";
    private static final String QUERY = "query";
    private static final String ESTIMATE = "estimate";
    private static final String DEFAULT = "default";
    private static final String DELIMITER = "delimiter";

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID = 1;
    public static final int EXIT_IO = 2;

    private static final Logger log = LoggerFactory.getLogger(GroupEstCLI.class);

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Run with the given arguments, estimates go to out.
     * 
     * @return exit status
     */
    public static int run(String[] args, PrintStream out) {
        Options opts = buildOptions();
        if(args.length < 1 || isHelpOption(args[0])) {
            printUsage(opts, out);
            return args.length < 1 ? EXIT_INVALID : EXIT_OK;
        }

        CommandLine cmd = null;
        try {
            cmd = new GnuParser().parse(opts, args);
        } catch (ParseException e) {
            log.error("Invalid command options: {}", e.getMessage());
            printUsage(opts, out);
            return EXIT_INVALID;
        }

        String target = cmd.getOptionValue(TARGET);
        try {
            CsvRowsLoader loader = cmd.hasOption(DELIMITER) ? new CsvRowsLoader(cmd.getOptionValue(DELIMITER))
                    : new CsvRowsLoader();
            CsvRowsLoader.TrainingData training = loader.loadTrainingData(new File(cmd.getOptionValue(TRAIN)),
                    target);

            GroupEstimator estimator = cmd.hasOption(ESTIMATE) ? new GroupEstimator(
                    EstimateType.of(cmd.getOptionValue(ESTIMATE))) : new GroupEstimator();
            estimator.fit(training.getRows(), training.getTarget(), cmd.getOptionValue(DEFAULT));

            double[] estimates = estimator.predict(loader.loadRows(new File(cmd.getOptionValue(QUERY)), target));
            for(double estimate: estimates) {
                out.println(estimate);
            }
            return EXIT_OK;
        } catch (GroupEstException e) {
            log.error("Failed to estimate: {}", e.getMessage());
            return EXIT_INVALID;
        } catch (IllegalArgumentException e) {
            log.error("Invalid input: {}", e.getMessage());
            return EXIT_INVALID;
        } catch (IOException e) {
            log.error("Failed to read input files", e);
            return EXIT_IO;
        }
    }

    @SuppressWarnings("static-access")
    private static Options buildOptions() {
        Options opts = new Options();

        Option optTrain = OptionBuilder.hasArg().isRequired().withDescription("Training csv file with header")
                .create(TRAIN);
        Option optTarget = OptionBuilder.hasArg().isRequired().withDescription("Target column of the training file")
                .create(TARGET);
        Option optQuery = OptionBuilder.hasArg().isRequired().withDescription("Query csv file with header")
                .create(QUERY);
        Option optEstimate = OptionBuilder.hasArg().withDescription("mean or median").create(ESTIMATE);
        Option optDefault = OptionBuilder.hasArg().withDescription("Column used as fallback for unseen groups")
                .create(DEFAULT);
        Option optDelimiter = OptionBuilder.hasArg().withDescription("Field delimiter, ',' by default")
                .create(DELIMITER);

        opts.addOption(optTrain);
        opts.addOption(optTarget);
        opts.addOption(optQuery);
        opts.addOption(optEstimate);
        opts.addOption(optDefault);
        opts.addOption(optDelimiter);
        return opts;
    }

    private static boolean isHelpOption(String arg) {
        return "-h".equalsIgnoreCase(arg) || "-help".equalsIgnoreCase(arg) || "--help".equalsIgnoreCase(arg);
    }

    private static void printUsage(Options opts, PrintStream out) {
        PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH,
                "GroupEstCLI -train <csv> -target <column> -query <csv>", null, opts,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }

}
