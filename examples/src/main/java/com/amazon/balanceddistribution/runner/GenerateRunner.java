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
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.balanceddistribution.BalancedDistribution;
import com.amazon.balanceddistribution.evaluation.DistanceEvaluation;
import com.amazon.balanceddistribution.evaluation.DistanceLabel;
import com.amazon.balanceddistribution.generation.BalancedDistributionGenerator;
import com.amazon.balanceddistribution.generation.CancellationFlag;
import com.amazon.balanceddistribution.generation.GenerationResult;
import com.amazon.balanceddistribution.generation.IGenerationListener;
import com.amazon.balanceddistribution.serialize.ModelArchive;

/**
 * Reads training vectors from the input rows, generates a Balanced
 * Distribution and saves it to a model archive. Nothing is written to the
 * archive when the generation is cancelled.
 *
 * <p>
 * After a successful save the Mahalanobis distances of all input rows are
 * stored with the model. With {@code --labeled true} the last column of each
 * row is a label code (0 unknown, 1 no anomaly, 2 anomaly) and is not part of
 * the feature vector.
 */
public class GenerateRunner extends SimpleRunner {

    private static final Logger LOG = LoggerFactory.getLogger(GenerateRunner.class);

    private final List<double[]> features;

    private final List<DistanceLabel> labels;

    private final ArgumentParser.BooleanArgument labeled;

    @Getter
    private final CancellationFlag cancellationFlag;

    @Getter
    private GenerationResult result;

    @Getter
    private DistanceEvaluation evaluation;

    public GenerateRunner() {
        super(GenerateRunner.class.getName(),
                "Generate a Balanced Distribution from the input rows and save it to a model archive. The first "
                        + "initial-normal-features rows must be free of anomalies.",
                null);
        labeled = new ArgumentParser.BooleanArgument(null, "--labeled",
                "Set to 'true' if the last column holds a label: 0 unknown, 1 no anomaly, 2 anomaly.", false);
        argumentParser.addArgument(labeled);
        features = new ArrayList<>();
        labels = new ArrayList<>();
        cancellationFlag = new CancellationFlag();
    }

    public static void main(String... args) throws IOException {
        GenerateRunner runner = new GenerateRunner();
        runner.parse(args);

        CountDownLatch finished = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runner.getCancellationFlag().cancel();
            try {
                finished.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));

        System.out.println("Reading from stdin... (Ctrl-c to cancel)");
        try {
            runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                    new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        } finally {
            finished.countDown();
        }
        System.out.println("Done.");
    }

    @Override
    protected void prepareAlgorithm(int columns) {
        if (labeled.getValue() && columns < 2) {
            throw new IllegalArgumentException("Labeled rows need at least one feature column and a label column.");
        }
        pointBuffer = new double[labeled.getValue() ? columns - 1 : columns];
    }

    @Override
    protected void writeHeader(String[] values, PrintWriter out) {
    }

    @Override
    protected void processLine(String[] values, PrintWriter out) {
        if (values.length == 1 && values[0].isEmpty()) {
            return;
        }
        if (labeled.getValue()) {
            checkLabeledLength(values);
            parsePoint(values);
            labels.add(parseLabel(values[getPointSize()]));
        } else {
            checkLength(values);
            parsePoint(values);
            labels.add(DistanceLabel.UNKNOWN);
        }
        features.add(pointBuffer.clone());
    }

    private void checkLabeledLength(String[] values) {
        if (values.length != getPointSize() + 1) {
            throw new IllegalArgumentException(String.format(
                    "Wrong number of values on line %d. Expected %d features and a label but found %d values.",
                    lineNumber, getPointSize(), values.length));
        }
    }

    private DistanceLabel parseLabel(String value) {
        try {
            return DistanceLabel.fromCode(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Label '%s' on line %d is not a label code", value, lineNumber), e);
        }
    }

    @Override
    protected void finish(PrintWriter out) throws IOException {
        BalancedDistributionGenerator generator = new BalancedDistributionGenerator(
                argumentParser.getHyperparameters(), argumentParser.getFitMode(), IGenerationListener.NONE);
        result = generator.generate(features, cancellationFlag);

        if (!result.isCompleted() || cancellationFlag.isCancellationRequested()) {
            LOG.warn("Interrupted!");
            out.println("Generation cancelled, no model saved.");
            return;
        }

        BalancedDistribution model = result.getModel().get();
        ModelArchive archive = new ModelArchive(Paths.get(argumentParser.getModelFile()));
        archive.save(argumentParser.getModelName(), model, ModelArchive.attributesOf(result));
        out.println(String.format("Generated Balanced Distribution '%s' with %d entries from %d feature vectors in %d ms",
                argumentParser.getModelName(), model.size(), result.getNumberOfFeatures(),
                result.getDurationMillis()));

        evaluation = model.getMahalanobisDistances(features, labels);
        archive.saveDistances(argumentParser.getModelName(), evaluation);
        out.println(String.format("Maximum Mahalanobis distance without anomaly %s, with anomaly %s",
                evaluation.getMaxNoAnomaly(), evaluation.getMaxAnomaly()));
    }

    public int getNumberOfFeatures() {
        return features.size();
    }
}
