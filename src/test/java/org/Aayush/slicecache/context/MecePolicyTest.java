package org.Aayush.slicecache.context;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.Aayush.slicecache.testutil.SliceFixtures.channel;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MecePolicy Tests")
class MecePolicyTest {

    private final MecePolicy policy = MecePolicy.defaults();

    @Test
    @DisplayName("CLOSED with every value present is COMPLETE")
    void testClosedComplete() {
        MeceCheck check = policy.evaluate("channel", channel(OtherPolicy.CLOSED), List.of("meta", "google"));

        assertEquals(MeceCheck.Status.COMPLETE, check.getStatus());
        assertEquals(List.of("google", "meta"), check.getPresentValues());
        assertTrue(check.getMissingValues().isEmpty());
        assertNull(check.getReasonCode());
    }

    @Test
    @DisplayName("CLOSED with a value missing is aggregable but partial")
    void testClosedPartial() {
        MeceCheck check = policy.evaluate("channel", channel(OtherPolicy.CLOSED), List.of("google"));

        assertEquals(MeceCheck.Status.PARTIAL_BUT_AGGREGABLE, check.getStatus());
        assertEquals(List.of("meta"), check.getMissingValues());
        assertTrue(check.isAggregable());
        assertFalse(check.isComplete());
    }

    @Test
    @DisplayName("COMPUTED_OTHER expects the synthesized catch-all")
    void testComputedOtherNeedsCatchAll() {
        ContextDefinition definition = channel(OtherPolicy.COMPUTED_OTHER);

        MeceCheck partial = policy.evaluate("channel", definition, List.of("google", "meta"));
        MeceCheck complete = policy.evaluate("channel", definition, List.of("google", "meta", "other"));

        assertEquals(MeceCheck.Status.PARTIAL_BUT_AGGREGABLE, partial.getStatus());
        assertEquals(List.of("other"), partial.getMissingValues());
        assertEquals(MeceCheck.Status.COMPLETE, complete.getStatus());
    }

    @Test
    @DisplayName("OPEN is never complete, even with every listed value")
    void testOpenNeverComplete() {
        MeceCheck check = policy.evaluate("channel", channel(OtherPolicy.OPEN), List.of("google", "meta"));

        assertEquals(MeceCheck.Status.PARTIAL_BUT_AGGREGABLE, check.getStatus());
        assertEquals(OtherPolicy.OPEN, check.getPolicy());
    }

    @Test
    @DisplayName("Null policy is treated as OPEN")
    void testNullPolicyIsOpen() {
        ContextDefinition definition = ContextDefinition.builder().key("channel").value("google").build();
        assertEquals(OtherPolicy.OPEN, definition.policy());
        assertFalse(policy.evaluate("channel", definition, List.of("google")).isComplete());
    }

    @Test
    @DisplayName("Unknown definition and unrecognised values are NOT_MECE with reason codes")
    void testNotMece() {
        MeceCheck unknown = policy.evaluate("region", null, List.of("eu"));
        MeceCheck unrecognised = policy.evaluate("channel", channel(OtherPolicy.CLOSED), List.of("google", "tiktok"));

        assertEquals(MeceCheck.Status.NOT_MECE, unknown.getStatus());
        assertEquals(MecePolicy.REASON_UNKNOWN_CONTEXT, unknown.getReasonCode());
        assertEquals(MeceCheck.Status.NOT_MECE, unrecognised.getStatus());
        assertEquals(MecePolicy.REASON_UNRECOGNISED_VALUE, unrecognised.getReasonCode());
        assertEquals(List.of("tiktok"), unrecognised.getUnrecognisedValues());
    }

    @Test
    @DisplayName("CLOSED catch-all value is not queryable")
    void testClosedRejectsCatchAll() {
        MeceCheck check = policy.evaluate("channel", channel(OtherPolicy.CLOSED), List.of("google", "meta", "other"));
        assertEquals(MeceCheck.Status.NOT_MECE, check.getStatus());
    }

    @Test
    @DisplayName("Aliases resolve to canonical values before evaluation")
    void testAliasesResolve() {
        ContextDefinition definition = channel(OtherPolicy.CLOSED).toBuilder().alias("fb", "meta").build();
        MeceCheck check = policy.evaluate("channel", definition, List.of("google", "fb"));

        assertEquals(MeceCheck.Status.COMPLETE, check.getStatus());
        assertEquals(List.of("google", "meta"), check.getPresentValues());
    }

    @Test
    @DisplayName("Definition validation rejects EXPLICIT_OTHER without a listed catch-all")
    void testExplicitOtherRequiresListedCatchAll() {
        MecePolicy.DefinitionException ex = assertThrows(
                MecePolicy.DefinitionException.class,
                () -> policy.validateDefinition(channel(OtherPolicy.EXPLICIT_OTHER))
        );
        assertEquals(MecePolicy.REASON_EXPLICIT_CATCH_ALL_MISSING, ex.reasonCode());

        ContextDefinition listed = channel(OtherPolicy.EXPLICIT_OTHER).toBuilder().value("other").build();
        policy.validateDefinition(listed);
        assertEquals(List.of("google", "meta", "other"), List.copyOf(listed.expectedValues()));
    }

    @Test
    @DisplayName("Definition validation rejects blank keys, blank values and duplicates")
    void testDefinitionValidation() {
        MecePolicy.DefinitionException blankKey = assertThrows(
                MecePolicy.DefinitionException.class,
                () -> policy.validateDefinition(ContextDefinition.builder().key(" ").build())
        );
        MecePolicy.DefinitionException duplicate = assertThrows(
                MecePolicy.DefinitionException.class,
                () -> policy.validateDefinition(channel(OtherPolicy.CLOSED).toBuilder().value("google").build())
        );
        MecePolicy.DefinitionException blankValue = assertThrows(
                MecePolicy.DefinitionException.class,
                () -> policy.validateDefinition(channel(OtherPolicy.CLOSED).toBuilder().value(" ").build())
        );

        assertEquals(MecePolicy.REASON_DEFINITION_KEY_REQUIRED, blankKey.reasonCode());
        assertEquals(MecePolicy.REASON_DUPLICATE_VALUE, duplicate.reasonCode());
        assertEquals(MecePolicy.REASON_BLANK_VALUE, blankValue.reasonCode());
    }
}
