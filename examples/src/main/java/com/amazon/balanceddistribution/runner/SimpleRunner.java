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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;
import java.util.function.Function;

import com.amazon.balanceddistribution.BalancedDistribution;
import com.amazon.balanceddistribution.exceptions.ShapeMismatchException;
import com.amazon.balanceddistribution.serialize.ModelArchive;

/**
 * Reads delimited feature vectors line by line and writes each line back with
 * the values computed by a {@link LineTransformer} appended. The model is
 * loaded from the archive named on the command line when the first line is
 * read.
 */
public class SimpleRunner {

    protected final ArgumentParser argumentParser;
    protected final Function<BalancedDistribution, LineTransformer> algorithmInitializer;
    protected LineTransformer algorithm;
    protected double[] pointBuffer;
    protected int lineNumber;

    public SimpleRunner(String runnerClass, String runnerDescription,
            Function<BalancedDistribution, LineTransformer> algorithmInitializer) {
        this(new ArgumentParser(runnerClass, runnerDescription), algorithmInitializer);
    }

    public SimpleRunner(ArgumentParser argumentParser,
            Function<BalancedDistribution, LineTransformer> algorithmInitializer) {
        this.argumentParser = argumentParser;
        this.algorithmInitializer = algorithmInitializer;
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            String[] values = line.split(argumentParser.getDelimiter());

            if (pointBuffer == null) {
                prepareAlgorithm(values.length);
            }

            if (lineNumber == 1 && argumentParser.getHeaderRow()) {
                writeHeader(values, out);
                continue;
            }

            processLine(values, out);
        }

        finish(out);
        out.flush();
    }

    protected void prepareAlgorithm(int dimensions) throws IOException {
        pointBuffer = new double[dimensions];
        BalancedDistribution model = new ModelArchive(Paths.get(argumentParser.getModelFile()))
                .load(argumentParser.getModelName());
        if (model.getDimensions() != dimensions) {
            throw new ShapeMismatchException(model.getDimensions(), dimensions);
        }
        algorithm = algorithmInitializer.apply(model);
    }

    protected void writeHeader(String[] values, PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        algorithm.getResultColumnNames().forEach(joiner::add);
        out.println(joiner.toString());
    }

    protected void processLine(String[] values, PrintWriter out) {
        List<String> result;
        if (values.length == 1 && values[0].isEmpty()) {
            result = algorithm.getEmptyResultValue();
        } else {
            checkLength(values);
            parsePoint(values);
            result = algorithm.getResultValues(pointBuffer);
        }

        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        result.forEach(joiner::add);

        out.println(joiner.toString());
    }

    protected void checkLength(String[] values) {
        if (values.length != pointBuffer.length) {
            throw new IllegalArgumentException(String.format("Wrong number of values on line %d. Expected %d but found %d.",
                    lineNumber, pointBuffer.length, values.length));
        }
    }

    protected void parsePoint(String... stringValues) {
        for (int i = 0; i < pointBuffer.length; i++) {
            try {
                pointBuffer[i] = Double.parseDouble(stringValues[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        String.format("Value '%s' on line %d is not a number", stringValues[i], lineNumber), e);
            }
        }
    }

    protected void finish(PrintWriter out) throws IOException {

    }

    protected int getPointSize() {
        return pointBuffer != null ? pointBuffer.length : 0;
    }
}
