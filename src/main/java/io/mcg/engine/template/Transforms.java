package io.mcg.engine.template;

import io.mcg.engine.config.ContextBuilderSpec.Computation;
import io.mcg.engine.config.ContextBuilderSpec.Transform;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Value derivations behind context builders. An empty result means the inputs were missing or
 * unusable and the builder's declared default applies.
 */
public final class Transforms {
    private Transforms() {}

    public static Optional<Object> apply(Transform transform, Object value) {
        return switch (transform.kind()) {
            case LIST_TO_STRING -> Optional.of(joined(value, transform.separator()));
            case UNIT_CONVERSION -> number(value).map(number -> (Object) (number * transform.factor()));
            case STEPS_CALCULATION -> number(value).flatMap(number -> steps(number * transform.multiplier(), transform.timestep()));
        };
    }

    private static Object joined(Object value, String separator) {
        if (value instanceof List<?> items) {
            List<String> parts = new ArrayList<>();
            for (Object item : items) {
                parts.add(TemplateRenderer.stringify(item));
            }
            return String.join(separator, parts);
        }
        return TemplateRenderer.stringify(value);
    }

    public static Optional<Object> compute(Computation computation, Map<String, Object> context) {
        return switch (computation.kind()) {
            case SCALED_STEPS -> scaledSteps(computation, context);
            case VECTOR_COMPONENT -> component(context.get(computation.source()), computation.index());
        };
    }

    private static Optional<Object> scaledSteps(Computation computation, Map<String, Object> context) {
        Optional<Double> time = number(context.get(computation.source()));
        Optional<Double> timestep = number(context.get(computation.timestepKey()));
        if (time.isEmpty() || timestep.isEmpty()) {
            return Optional.empty();
        }
        return steps(time.get() * computation.scale(), timestep.get());
    }

    private static Optional<Object> component(Object vector, int index) {
        if (vector instanceof List<?> items && index >= 0 && index < items.size()) {
            return Optional.ofNullable(items.get(index));
        }
        return Optional.empty();
    }

    /** Step count, truncated toward zero. */
    private static Optional<Object> steps(double scaledTime, double timestep) {
        if (timestep == 0.0 || Double.isNaN(scaledTime) || Double.isInfinite(scaledTime)) {
            return Optional.empty();
        }
        return Optional.of((long) (scaledTime / timestep));
    }

    private static Optional<Double> number(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        return Optional.empty();
    }
}
