package com.servicetracker.irita.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Conjunction of {@code eventType.attribute = value} conditions over a block's end-block events.
 * A condition holds when at least one event of that type carries the attribute with that exact value.
 */
public final class EventQuery {

    private final List<Condition> conditions;

    private EventQuery(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Condition> conditions() {
        return conditions;
    }

    public boolean matches(List<BlockEvent> events) {
        if (events == null || events.isEmpty()) {
            return conditions.isEmpty();
        }
        for (Condition c : conditions) {
            boolean satisfied = events.stream()
                    .anyMatch(e -> e.isType(c.eventType()) && c.value().equals(e.attribute(c.attribute())));
            if (!satisfied) {
                return false;
            }
        }
        return true;
    }

    /**
     * Tendermint query syntax, e.g. {@code new_batch_request.service_name='oracle'}.
     */
    public String toQueryString() {
        return conditions.stream()
                .map(c -> c.eventType() + "." + c.attribute() + "='" + c.value().replace("'", "\\'") + "'")
                .collect(Collectors.joining(" AND "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventQuery other)) return false;
        return conditions.equals(other.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conditions);
    }

    @Override
    public String toString() {
        return toQueryString();
    }

    public record Condition(String eventType, String attribute, String value) {

        public Condition {
            Objects.requireNonNull(eventType, "eventType");
            Objects.requireNonNull(attribute, "attribute");
            Objects.requireNonNull(value, "value");
        }
    }

    public static final class Builder {

        private final List<Condition> conditions = new ArrayList<>();

        private Builder() {
        }

        public Builder eq(String eventType, String attribute, String value) {
            conditions.add(new Condition(eventType, attribute, value));
            return this;
        }

        public EventQuery build() {
            return new EventQuery(conditions);
        }
    }
}
