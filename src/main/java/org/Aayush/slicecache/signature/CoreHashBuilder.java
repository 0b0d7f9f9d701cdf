package org.Aayush.slicecache.signature;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the core hash of a query identity.
 *
 * <p>Inputs are the facts that change what is being asked of the source: connection, stable
 * event ids, resolved event-definition fingerprints, filter predicates, case constraints and
 * the structural query shape. Display labels are never inputs. Set-like inputs are sorted so
 * declaration order does not change the hash.</p>
 */
public final class CoreHashBuilder {
    private String connection;
    private String fromEventId;
    private String toEventId;
    private final TreeSet<String> visitedEventIds = new TreeSet<>();
    private final TreeSet<String> excludedEventIds = new TreeSet<>();
    private final TreeMap<String, String> eventDefinitionHashes = new TreeMap<>();
    private final TreeMap<String, String> eventFilters = new TreeMap<>();
    private final TreeSet<String> caseConstraints = new TreeSet<>();
    private String queryShape;

    public CoreHashBuilder connection(String connection) {
        this.connection = connection;
        return this;
    }

    public CoreHashBuilder fromEvent(String eventId) {
        this.fromEventId = eventId;
        return this;
    }

    public CoreHashBuilder toEvent(String eventId) {
        this.toEventId = eventId;
        return this;
    }

    public CoreHashBuilder visited(Collection<String> eventIds) {
        visitedEventIds.addAll(eventIds);
        return this;
    }

    public CoreHashBuilder excluded(Collection<String> eventIds) {
        excludedEventIds.addAll(eventIds);
        return this;
    }

    /**
     * Records the fingerprint of an event's resolved definition.
     */
    public CoreHashBuilder eventDefinition(String eventId, String definitionHash) {
        eventDefinitionHashes.put(
                Objects.requireNonNull(eventId, "eventId"),
                Objects.requireNonNull(definitionHash, "definitionHash")
        );
        return this;
    }

    public CoreHashBuilder eventFilter(String eventId, String predicate) {
        eventFilters.put(Objects.requireNonNull(eventId, "eventId"), Objects.requireNonNull(predicate, "predicate"));
        return this;
    }

    public CoreHashBuilder caseConstraint(String constraint) {
        caseConstraints.add(Objects.requireNonNull(constraint, "constraint"));
        return this;
    }

    public CoreHashBuilder queryShape(String shape) {
        this.queryShape = shape;
        return this;
    }

    /**
     * Returns the canonical identity document that is hashed.
     */
    public Map<String, Object> identity() {
        if (connection == null || connection.isBlank()) {
            throw new IllegalStateException("connection is required for a core hash");
        }
        LinkedHashMap<String, Object> identity = new LinkedHashMap<>();
        identity.put("connection", connection.trim());
        identity.put("from", fromEventId);
        identity.put("to", toEventId);
        identity.put("visited", sortedList(visitedEventIds));
        identity.put("excluded", sortedList(excludedEventIds));
        identity.put("eventDefinitions", eventDefinitionHashes);
        identity.put("filters", eventFilters);
        identity.put("cases", sortedList(caseConstraints));
        identity.put("shape", queryShape == null ? "" : queryShape);
        return identity;
    }

    /**
     * Returns the SHA-256 core hash.
     */
    public String build() {
        return CanonicalHashing.sha256Hex(identity());
    }

    private static List<String> sortedList(TreeSet<String> values) {
        return new ArrayList<>(values);
    }
}
