package io.github.jsummarise.agg;

import io.github.jsummarise.exception.InvalidArgumentException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Non-empty ordered list of the functions one request applies.
 */
public final class FunctionSpec implements Iterable<FunctionRef> {
    private final List<FunctionRef> functions;

    private FunctionSpec(List<FunctionRef> functions) {
        this.functions = functions;
    }

    public static FunctionSpec of(List<FunctionRef> functions) {
        if (functions.isEmpty()) {
            throw new InvalidArgumentException("at least one aggregation function is required");
        }
        return new FunctionSpec(Collections.unmodifiableList(new ArrayList<>(functions)));
    }

    public static FunctionSpec of(FunctionRef... functions) {
        return of(Arrays.asList(functions));
    }

    public List<FunctionRef> functions() {
        return functions;
    }

    public FunctionRef get(int i) {
        return functions.get(i);
    }

    public int size() {
        return functions.size();
    }

    public List<String> labels() {
        List<String> labels = new ArrayList<>(functions.size());
        for (FunctionRef function : functions) {
            labels.add(function.label());
        }
        return labels;
    }

    public boolean containsDescribe() {
        for (FunctionRef function : functions) {
            if (function.isDescribe()) {
                return true;
            }
        }
        return false;
    }

    public boolean isDescribe() {
        return functions.size() == 1 && functions.get(0).isDescribe();
    }

    public boolean allCallable() {
        for (FunctionRef function : functions) {
            if (!function.isCallable()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Iterator<FunctionRef> iterator() {
        return functions.iterator();
    }

    @Override
    public String toString() {
        return functions.toString();
    }
}
