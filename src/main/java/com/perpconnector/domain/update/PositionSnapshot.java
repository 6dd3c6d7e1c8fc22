package com.perpconnector.domain.update;

import com.perpconnector.domain.enums.UpdateSource;
import com.perpconnector.domain.model.Position;
import java.time.Instant;
import java.util.List;

/** Full set of nonzero account positions. Replaces the ledger's positions wholesale. */
public record PositionSnapshot(List<Position> positions, Instant timestamp, UpdateSource source)
        implements CanonicalUpdate {

    public PositionSnapshot {
        positions = List.copyOf(positions);
    }
}
