package org.caseview.model;

import org.caseview.api.UnknownVariableException;
import org.caseview.metadata.MetadataCatalog;
import org.caseview.metadata.VariableMetadata;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One recorded event: the state captured at a single iteration coordinate.
 * <p>
 * Which value groups are present depends on the category and on the recording
 * options; an absent group is {@code null}, not empty. For problem cases the
 * identifying key is the user-supplied case name. Instances are immutable.
 */
public final class Case {

    private final Category category;
    private final String iterationCoordinate;
    private final String source;
    private final long counter;
    private final double timestamp;
    private final boolean success;
    private final String message;
    private final CaseValues inputs;
    private final CaseValues outputs;
    private final CaseValues residuals;
    private final Double absoluteError;
    private final Double relativeError;
    private final Jacobian jacobian;
    private final MetadataCatalog catalog;

    private Case(Builder builder) {
        this.category = Objects.requireNonNull(builder.category, "category");
        this.iterationCoordinate = Objects.requireNonNull(builder.iterationCoordinate, "iterationCoordinate");
        this.source = builder.source;
        this.counter = builder.counter;
        this.timestamp = builder.timestamp;
        this.success = builder.success;
        this.message = builder.message;
        this.inputs = builder.inputs;
        this.outputs = builder.outputs;
        this.residuals = builder.residuals;
        this.absoluteError = builder.absoluteError;
        this.relativeError = builder.relativeError;
        this.jacobian = builder.jacobian;
        this.catalog = builder.catalog;
    }

    public static Builder builder(Category category, String iterationCoordinate) {
        return new Builder(category, iterationCoordinate);
    }

    public Category category() {
        return category;
    }

    /**
     * @return the iteration coordinate, or the case name for problem cases.
     */
    public String iterationCoordinate() {
        return iterationCoordinate;
    }

    /**
     * @return the source this case was recorded by, e.g. {@code driver} or {@code root.nonlinear_solver}.
     */
    public String source() {
        return source;
    }

    public long counter() {
        return counter;
    }

    /**
     * @return seconds since the epoch.
     */
    public double timestamp() {
        return timestamp;
    }

    public boolean success() {
        return success;
    }

    public String message() {
        return message;
    }

    public CaseValues inputs() {
        return inputs;
    }

    public CaseValues outputs() {
        return outputs;
    }

    public CaseValues residuals() {
        return residuals;
    }

    /**
     * @return the solver's absolute error, or {@code null} for other categories.
     */
    public Double absoluteError() {
        return absoluteError;
    }

    /**
     * @return the solver's relative error, or {@code null} for other categories.
     */
    public Double relativeError() {
        return relativeError;
    }

    /**
     * @return the recorded total derivatives, or {@code null} when none were recorded.
     */
    public Jacobian jacobian() {
        return jacobian;
    }

    /**
     * Returns a variable's value, searching outputs before inputs.
     *
     * @param name an absolute or promoted name
     * @throws UnknownVariableException if neither group records the name.
     */
    public ShapedArray get(String name) {
        if (outputs != null) {
            Optional<ShapedArray> value = outputs.find(name);
            if (value.isPresent()) {
                return value.get();
            }
        }
        if (inputs != null) {
            Optional<ShapedArray> value = inputs.find(name);
            if (value.isPresent()) {
                return value.get();
            }
        }
        throw new UnknownVariableException(name, "Variable '" + name + "' is not recorded in case '"
            + iterationCoordinate + "'");
    }

    /**
     * @return recorded design variable values keyed by promoted name.
     */
    public Map<String, ShapedArray> designVariables() {
        return outputsOfType(VariableMetadata.DESIGN_VARIABLE);
    }

    /**
     * @return recorded objective values keyed by promoted name.
     */
    public Map<String, ShapedArray> objectives() {
        return outputsOfType(VariableMetadata.OBJECTIVE);
    }

    /**
     * @return recorded constraint values keyed by promoted name.
     */
    public Map<String, ShapedArray> constraints() {
        return outputsOfType(VariableMetadata.CONSTRAINT);
    }

    /**
     * @return objectives followed by constraints.
     */
    public Map<String, ShapedArray> responses() {
        Map<String, ShapedArray> result = new LinkedHashMap<>(objectives());
        result.putAll(constraints());
        return result;
    }

    private Map<String, ShapedArray> outputsOfType(String type) {
        Map<String, ShapedArray> result = new LinkedHashMap<>();
        if (outputs == null || catalog == null) {
            return result;
        }
        for (VariableMetadata meta : catalog.variablesOfType(type)) {
            String absolute = meta.absoluteName();
            String name = catalog.promotedName(absolute, outputs.namespace()).orElse(absolute);
            ShapedArray value = outputs.asMap().get(absolute);
            if (value == null) {
                value = outputs.asMap().get(name);
            }
            if (value != null) {
                result.put(name, value);
            }
        }
        return result;
    }

    /**
     * Hands the recorded outputs, then the recorded inputs, to a sink.
     */
    public void exportTo(ModelSink sink) {
        if (outputs != null) {
            outputs.asMap().forEach(sink::setValue);
        }
        if (inputs != null) {
            inputs.asMap().forEach(sink::setValue);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Case other)) {
            return false;
        }
        return category == other.category
            && counter == other.counter
            && Double.compare(timestamp, other.timestamp) == 0
            && success == other.success
            && iterationCoordinate.equals(other.iterationCoordinate)
            && Objects.equals(source, other.source)
            && Objects.equals(message, other.message)
            && Objects.equals(inputs, other.inputs)
            && Objects.equals(outputs, other.outputs)
            && Objects.equals(residuals, other.residuals)
            && Objects.equals(absoluteError, other.absoluteError)
            && Objects.equals(relativeError, other.relativeError)
            && Objects.equals(jacobian, other.jacobian);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, iterationCoordinate, counter, outputs);
    }

    @Override
    public String toString() {
        return "Case{" + category.label() + " '" + iterationCoordinate + "' counter=" + counter + "}";
    }

    /**
     * Assembles a {@link Case} from a decoded row.
     */
    public static final class Builder {
        private final Category category;
        private final String iterationCoordinate;
        private String source;
        private long counter;
        private double timestamp;
        private boolean success = true;
        private String message;
        private CaseValues inputs;
        private CaseValues outputs;
        private CaseValues residuals;
        private Double absoluteError;
        private Double relativeError;
        private Jacobian jacobian;
        private MetadataCatalog catalog;

        private Builder(Category category, String iterationCoordinate) {
            this.category = category;
            this.iterationCoordinate = iterationCoordinate;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder counter(long counter) {
            this.counter = counter;
            return this;
        }

        public Builder timestamp(double timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder inputs(CaseValues inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(CaseValues outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder residuals(CaseValues residuals) {
            this.residuals = residuals;
            return this;
        }

        public Builder absoluteError(Double absoluteError) {
            this.absoluteError = absoluteError;
            return this;
        }

        public Builder relativeError(Double relativeError) {
            this.relativeError = relativeError;
            return this;
        }

        public Builder jacobian(Jacobian jacobian) {
            this.jacobian = jacobian;
            return this;
        }

        public Builder catalog(MetadataCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Case build() {
            return new Case(this);
        }
    }
}
