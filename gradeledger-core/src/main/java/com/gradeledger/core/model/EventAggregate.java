package com.gradeledger.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Reference from a domain event to the aggregate it describes.
 * The version is optional; gradebook recomputes, for instance, carry none.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventAggregate(
    AggregateKind kind,
    String id,
    Integer version
) {
    public static EventAggregate of(AggregateKind kind, String id, int version) {
        return new EventAggregate(kind, id, version);
    }

    public static EventAggregate unversioned(AggregateKind kind, String id) {
        return new EventAggregate(kind, id, null);
    }
}
