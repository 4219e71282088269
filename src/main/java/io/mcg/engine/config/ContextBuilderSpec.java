package io.mcg.engine.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Declared derivation of one context key. Exactly one of {@code transform} (for
 * {@link BuilderKind#PARAMETER_TRANSFORM}) or {@code computation} (for
 * {@link BuilderKind#COMPUTED_VALUE}) is present. {@code fallback} is the declared
 * {@code default}, used whenever the inputs are missing or unusable.
 */
public record ContextBuilderSpec(
    String name,
    BuilderKind kind,
    Optional<String> source,
    Optional<Transform> transform,
    Optional<Computation> computation,
    Optional<Object> fallback
) {
    public ContextBuilderSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        source = source == null ? Optional.empty() : source;
        transform = transform == null ? Optional.empty() : transform;
        computation = computation == null ? Optional.empty() : computation;
        fallback = fallback == null ? Optional.empty() : fallback;
    }

    public static ContextBuilderSpec transform(String name, String source, Transform transform, Object fallback) {
        return new ContextBuilderSpec(name, BuilderKind.PARAMETER_TRANSFORM, Optional.of(source), Optional.of(transform),
            Optional.empty(), Optional.ofNullable(fallback));
    }

    public static ContextBuilderSpec computed(String name, Computation computation, Object fallback) {
        return new ContextBuilderSpec(name, BuilderKind.COMPUTED_VALUE, Optional.empty(), Optional.empty(),
            Optional.of(computation), Optional.ofNullable(fallback));
    }

    /**
     * @param separator used by {@code list_to_string}
     * @param factor used by {@code unit_conversion}
     * @param multiplier used by {@code steps_calculation}
     * @param timestep used by {@code steps_calculation}
     */
    public record Transform(TransformKind kind, String separator, double factor, double multiplier, double timestep) {
        public static Transform listToString(String separator) {
            return new Transform(TransformKind.LIST_TO_STRING, separator, 1.0, 1000.0, 1.0);
        }

        public static Transform unitConversion(double factor) {
            return new Transform(TransformKind.UNIT_CONVERSION, " ", factor, 1000.0, 1.0);
        }

        public static Transform stepsCalculation(double multiplier, double timestep) {
            return new Transform(TransformKind.STEPS_CALCULATION, " ", 1.0, multiplier, timestep);
        }
    }

    /**
     * @param source context key holding the time value or the vector
     * @param scale multiplier applied before dividing by the timestep ({@code scaled_steps})
     * @param timestepKey context key holding the timestep ({@code scaled_steps})
     * @param index vector component ({@code vector_component})
     */
    public record Computation(ComputationKind kind, String source, double scale, String timestepKey, int index) {
        public static Computation scaledSteps(String source, double scale, String timestepKey) {
            return new Computation(ComputationKind.SCALED_STEPS, source, scale, timestepKey, 0);
        }

        public static Computation vectorComponent(String source, int index) {
            return new Computation(ComputationKind.VECTOR_COMPONENT, source, 1.0, null, index);
        }
    }
}
