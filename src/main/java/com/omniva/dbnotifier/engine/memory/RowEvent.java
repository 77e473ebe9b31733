package com.omniva.dbnotifier.engine.memory;

import com.omniva.dbnotifier.messaging.model.ChangeType;
import com.omniva.dbnotifier.synthesis.RowImage;

import java.time.OffsetDateTime;

/**
 * What a row-level trigger sees when it fires
 *
 * @param oldRow pre-image, null for INSERT
 * @param newRow post-image, null for DELETE
 */
public record RowEvent(
        String tableName,
        ChangeType type,
        RowImage oldRow,
        RowImage newRow,
        OffsetDateTime transactionTimestamp
) {
}
