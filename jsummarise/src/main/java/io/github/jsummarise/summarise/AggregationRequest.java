package io.github.jsummarise.summarise;

import io.github.jsummarise.agg.FunctionSpec;
import io.github.jsummarise.selector.ColumnSelector;

import static java.util.Objects.requireNonNull;

public final class AggregationRequest {
    public static final String COLUMN_PLACEHOLDER = "{_col}";
    public static final String FUNCTION_PLACEHOLDER = "{_fn}";

    private final ColumnSelector col;
    private final FunctionSpec func;
    private final String name;

    public AggregationRequest(ColumnSelector col, FunctionSpec func, String name) {
        this.col = requireNonNull(col);
        this.func = requireNonNull(func);
        this.name = name;
    }

    public ColumnSelector col() {
        return col;
    }

    public FunctionSpec func() {
        return func;
    }

    /**
     * @return result label, null when the request keeps the generated labels
     */
    public String name() {
        return name;
    }

    public boolean hasName() {
        return null != name;
    }

    /**
     * a name with {_col} or {_fn} placeholders labels every output column instead of a single one
     */
    public boolean isNameTemplate() {
        return hasName() && (name.contains(COLUMN_PLACEHOLDER) || name.contains(FUNCTION_PLACEHOLDER));
    }

    public String expandName(String column, String function) {
        return name.replace(COLUMN_PLACEHOLDER, column).replace(FUNCTION_PLACEHOLDER, function);
    }

    @Override
    public String toString() {
        return "(" + col + ", " + func + (hasName() ? ", '" + name + "'" : "") + ")";
    }
}
