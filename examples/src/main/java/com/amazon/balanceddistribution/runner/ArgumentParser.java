/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.balanceddistribution.runner;

import static com.amazon.balanceddistribution.CommonUtils.checkArgument;
import static com.amazon.balanceddistribution.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.balanceddistribution.BalancedDistribution;
import com.amazon.balanceddistribution.config.FitMode;
import com.amazon.balanceddistribution.config.Hyperparameters;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/balanced-distribution-examples-1.0.jar";
    public static final String DEFAULT_MODEL_FILE = "balanced_distribution.bin";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final IntegerArgument initialNormalFeatures;
    private final DoubleArgument thresholdLearning;
    private final DoubleArgument thresholdClassification;
    private final DoubleArgument pruningParameter;
    private final StringArgument fitMode;
    private final StringArgument modelFile;
    private final StringArgument modelName;
    private final StringArgument delimiter;
    private final BooleanArgument headerRow;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        initialNormalFeatures = new IntegerArgument("-n", "--initial-normal-features",
                "Number of leading feature vectors assumed to be free of anomalies.",
                Hyperparameters.DEFAULT_INITIAL_NORMAL_FEATURES,
                n -> checkArgument(n > 0, "initial normal features should be greater than 0"));

        addArgument(initialNormalFeatures);

        thresholdLearning = new DoubleArgument("-a", "--threshold-learning",
                "Mahalanobis distance above which a feature vector is added during growth.",
                Hyperparameters.DEFAULT_THRESHOLD_LEARNING);

        addArgument(thresholdLearning);

        thresholdClassification = new DoubleArgument("-b", "--threshold-classification",
                "Mahalanobis distance above which a feature vector is anomalous.",
                Hyperparameters.DEFAULT_THRESHOLD_CLASSIFICATION);

        addArgument(thresholdClassification);

        pruningParameter = new DoubleArgument("-p", "--pruning-parameter",
                "Fraction of the learning threshold below which retained vectors are pruned, between 0 and 1.",
                Hyperparameters.DEFAULT_PRUNING_PARAMETER);

        addArgument(pruningParameter);

        fitMode = new StringArgument(null, "--fit-mode",
                "How the statistics are refit during growth, one of " + Arrays.toString(FitMode.values()) + ".",
                FitMode.FULL_REFIT.name(), FitMode::valueOf);

        addArgument(fitMode);

        modelFile = new StringArgument("-f", "--model-file", "The model archive to write or read.",
                DEFAULT_MODEL_FILE);

        addArgument(modelFile);

        modelName = new StringArgument(null, "--model-name", "The name of the model inside the archive.",
                BalancedDistribution.MODEL_NAME);

        addArgument(modelName);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                ",");

        addArgument(delimiter);

        headerRow = new BooleanArgument(null, "--header-row", "Set to 'true' if the data contains a header row.",
                false);

        addArgument(headerRow);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that should
     *                 be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Remove the argument with the given long flag from help messages. This
     * allows subclasses to suppress arguments as needed. The argument will still
     * exist in this object with its default value.
     *
     * @param longFlag The long flag corresponding to the argument being removed
     */
    protected void removeArgument(String longFlag) {
        Argument<?> argument = longFlags.get(longFlag);
        if (argument != null) {
            longFlags.remove(longFlag);
            if (argument.getShortFlag() != null) {
                shortFlags.remove(argument.getShortFlag());
            }
        }
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -cp %s %s [options] < input_file > output_file", ARCHIVE_NAME,
                runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    public int getInitialNormalFeatures() {
        return initialNormalFeatures.getValue();
    }

    public double getThresholdLearning() {
        return thresholdLearning.getValue();
    }

    public double getThresholdClassification() {
        return thresholdClassification.getValue();
    }

    public double getPruningParameter() {
        return pruningParameter.getValue();
    }

    /**
     * @return the hyperparameters given on the command line
     * @throws com.amazon.balanceddistribution.exceptions.InvalidParameterException
     *         if a value is out of range
     */
    public Hyperparameters getHyperparameters() {
        return new Hyperparameters(getInitialNormalFeatures(), getThresholdLearning(), getThresholdClassification(),
                getPruningParameter());
    }

    public FitMode getFitMode() {
        return FitMode.valueOf(fitMode.getValue());
    }

    /**
     * @return the user-specified value of the model-file parameter
     */
    public String getModelFile() {
        return modelFile.getValue();
    }

    /**
     * @return the user-specified value of the model-name parameter
     */
    public String getModelName() {
        return modelName.getValue();
    }

    /**
     * @return the user-specified value of the delimiter parameter
     */
    public String getDelimiter() {
        return delimiter.getValue();
    }

    /**
     * @return the user-specified value of the header-row parameter
     */
    public boolean getHeaderRow() {
        return headerRow.getValue();
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }

        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble);
        }
    }
}
