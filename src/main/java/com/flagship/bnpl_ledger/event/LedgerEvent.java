package com.flagship.bnpl_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact recorded by the ledger and published through the outbox.
 *
 * Events describe what happened, never what should happen next; downstream consumers
 * de-duplicate on {@link #getEventId()}.
 */
public interface LedgerEvent {

    UUID getEventId();

    /**
     * Id of the entity the event is about; used as the Kafka partition key.
     */
    UUID getAggregateId();

    String getAggregateType();

    String getEventType();

    Instant getOccurredAt();
}
