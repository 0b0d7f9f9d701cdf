package org.Aayush.slicecache.context;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * MECE evaluation of dimension values against context definitions.
 *
 * <p>Membership is declared by the definition's policy; overlap between values is not
 * certified here. Evaluation rules:</p>
 * <ul>
 * <li>Unknown definition or any unrecognised value: {@code NOT_MECE}.</li>
 * <li>{@code CLOSED}, {@code COMPUTED_OTHER}, {@code EXPLICIT_OTHER}: {@code COMPLETE} when the
 * full expected set is present, {@code PARTIAL_BUT_AGGREGABLE} otherwise.</li>
 * <li>{@code OPEN}: always {@code PARTIAL_BUT_AGGREGABLE}.</li>
 * </ul>
 */
public final class MecePolicy {
    public static final String REASON_UNKNOWN_CONTEXT = "MECE_UNKNOWN_CONTEXT";
    public static final String REASON_UNRECOGNISED_VALUE = "MECE_UNRECOGNISED_VALUE";
    public static final String REASON_DEFINITION_KEY_REQUIRED = "MECE_DEFINITION_KEY_REQUIRED";
    public static final String REASON_EXPLICIT_CATCH_ALL_MISSING = "MECE_EXPLICIT_CATCH_ALL_MISSING";
    public static final String REASON_DUPLICATE_VALUE = "MECE_DUPLICATE_VALUE";
    public static final String REASON_BLANK_VALUE = "MECE_BLANK_VALUE";

    /**
     * Evaluates the values present for one dimension.
     *
     * @param key dimension key.
     * @param definition dimension definition, or {@code null} when unknown.
     * @param rawValues values observed among slices; aliases are resolved first.
     * @return immutable check result.
     */
    public MeceCheck evaluate(String key, ContextDefinition definition, Collection<String> rawValues) {
        Objects.requireNonNull(rawValues, "rawValues");
        MeceCheck.MeceCheckBuilder builder = MeceCheck.builder().key(key);
        if (definition == null) {
            return builder
                    .status(MeceCheck.Status.NOT_MECE)
                    .reasonCode(REASON_UNKNOWN_CONTEXT)
                    .presentValues(new TreeSet<>(rawValues))
                    .build();
        }

        OtherPolicy policy = definition.policy();
        Set<String> expected = definition.expectedValues();
        TreeSet<String> present = new TreeSet<>();
        TreeSet<String> unrecognised = new TreeSet<>();
        for (String raw : rawValues) {
            String canonical = definition.canonicalValue(raw);
            if (expected.contains(canonical)) {
                present.add(canonical);
            } else {
                unrecognised.add(raw);
            }
        }
        builder.policy(policy).presentValues(present);

        if (!unrecognised.isEmpty()) {
            return builder
                    .status(MeceCheck.Status.NOT_MECE)
                    .reasonCode(REASON_UNRECOGNISED_VALUE)
                    .unrecognisedValues(unrecognised)
                    .build();
        }

        TreeSet<String> missing = new TreeSet<>(expected);
        missing.removeAll(present);
        builder.missingValues(missing);

        MeceCheck.Status status = switch (policy) {
            case CLOSED, COMPUTED_OTHER, EXPLICIT_OTHER -> missing.isEmpty()
                    ? MeceCheck.Status.COMPLETE
                    : MeceCheck.Status.PARTIAL_BUT_AGGREGABLE;
            case OPEN -> MeceCheck.Status.PARTIAL_BUT_AGGREGABLE;
        };
        return builder.status(status).build();
    }

    /**
     * Validates one definition before it is admitted into a registry.
     *
     * @throws DefinitionException with a stable reason code on violation.
     */
    public void validateDefinition(ContextDefinition definition) {
        ContextDefinition nonNullDefinition = Objects.requireNonNull(definition, "definition");
        if (nonNullDefinition.getKey() == null || nonNullDefinition.getKey().isBlank()) {
            throw new DefinitionException(REASON_DEFINITION_KEY_REQUIRED, "context definition key must be non-blank");
        }
        Set<String> seen = new TreeSet<>();
        for (String value : nonNullDefinition.getValues()) {
            if (value == null || value.isBlank()) {
                throw new DefinitionException(
                        REASON_BLANK_VALUE,
                        "context " + nonNullDefinition.getKey() + " declares a blank value id"
                );
            }
            if (!seen.add(value)) {
                throw new DefinitionException(
                        REASON_DUPLICATE_VALUE,
                        "context " + nonNullDefinition.getKey() + " declares value " + value + " twice"
                );
            }
        }
        if (nonNullDefinition.policy() == OtherPolicy.EXPLICIT_OTHER && !nonNullDefinition.listsCatchAll()) {
            throw new DefinitionException(
                    REASON_EXPLICIT_CATCH_ALL_MISSING,
                    "context " + nonNullDefinition.getKey() + " uses EXPLICIT_OTHER but does not define '"
                            + nonNullDefinition.catchAll() + "'"
            );
        }
    }

    /**
     * Returns default MECE policy.
     */
    public static MecePolicy defaults() {
        return new MecePolicy();
    }

    /**
     * Reason-coded definition validation failure.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class DefinitionException extends RuntimeException {
        private final String reasonCode;

        /**
         * Creates a reason-coded definition failure.
         */
        public DefinitionException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}
