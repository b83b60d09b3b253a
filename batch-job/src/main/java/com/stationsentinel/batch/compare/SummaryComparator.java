package com.stationsentinel.batch.compare;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stationsentinel.core.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural comparison of two summary documents.
 *
 * <p>
 * Objects are compared key by key, arrays element by element. Floating-point
 * values match when they are within {@value #TOLERANCE} relative or absolute
 * distance. The {@value RunSummary#ELAPSED_FIELD} field is ignored at any
 * depth, so runs with different timings but equal results compare equal.
 * </p>
 *
 * @since 1.0.0
 */
public final class SummaryComparator {

    private static final Logger LOG = LoggerFactory.getLogger(SummaryComparator.class);

    static final double TOLERANCE = 1e-9;

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @param expected reference summary file
     * @param actual   summary file to check
     * @return human-readable differences; empty when the files agree
     * @throws UncheckedIOException if a file cannot be read or parsed
     */
    public List<String> compare(Path expected, Path actual) {
        Objects.requireNonNull(expected, "expected path must not be null");
        Objects.requireNonNull(actual, "actual path must not be null");
        LOG.info("Comparing {} with {}", expected, actual);
        return compare(readTree(expected), readTree(actual));
    }

    /**
     * @param expected reference document
     * @param actual   document to check
     * @return human-readable differences; empty when the documents agree
     */
    public List<String> compare(JsonNode expected, JsonNode actual) {
        List<String> differences = new ArrayList<>();
        compareNodes(expected, actual, "", differences);
        return differences;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void compareNodes(JsonNode expected, JsonNode actual, String path, List<String> differences) {
        if (expected.isObject() && actual.isObject()) {
            compareObjects(expected, actual, path, differences);
        } else if (expected.isArray() && actual.isArray()) {
            if (expected.size() != actual.size()) {
                differences.add("Array size differs at '" + path + "': "
                        + expected.size() + " != " + actual.size());
                return;
            }
            for (int i = 0; i < expected.size(); i++) {
                compareNodes(expected.get(i), actual.get(i), path + "[" + i + "]", differences);
            }
        } else if (expected.isNumber() && actual.isNumber()) {
            if (!isClose(expected.doubleValue(), actual.doubleValue())) {
                differences.add("Value differs at '" + path + "': " + expected + " != " + actual);
            }
        } else if (!expected.equals(actual)) {
            differences.add("Value differs at '" + path + "': " + expected + " != " + actual);
        }
    }

    private void compareObjects(JsonNode expected, JsonNode actual, String path, List<String> differences) {
        Set<String> expectedKeys = fieldNames(expected);
        Set<String> actualKeys = fieldNames(actual);
        if (!expectedKeys.equals(actualKeys)) {
            Set<String> onlyExpected = new TreeSet<>(expectedKeys);
            onlyExpected.removeAll(actualKeys);
            Set<String> onlyActual = new TreeSet<>(actualKeys);
            onlyActual.removeAll(expectedKeys);
            differences.add("Key sets differ at '" + path + "': only in expected " + onlyExpected
                    + ", only in actual " + onlyActual);
            return;
        }
        for (String key : expectedKeys) {
            if (RunSummary.ELAPSED_FIELD.equals(key)) {
                continue;
            }
            String child = path.isEmpty() ? key : path + "." + key;
            compareNodes(expected.get(key), actual.get(key), child, differences);
        }
    }

    private static Set<String> fieldNames(JsonNode node) {
        Set<String> names = new TreeSet<>();
        Iterator<String> it = node.fieldNames();
        while (it.hasNext()) {
            names.add(it.next());
        }
        return names;
    }

    static boolean isClose(double a, double b) {
        if (a == b) {
            return true;
        }
        double diff = Math.abs(a - b);
        return diff <= TOLERANCE || diff <= TOLERANCE * Math.max(Math.abs(a), Math.abs(b));
    }

    private JsonNode readTree(Path path) {
        try {
            return mapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read summary: " + path, e);
        }
    }
}
