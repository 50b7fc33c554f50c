package com.baykanat.insider.insights.domain.source;

import java.time.Instant;
import java.util.Optional;

/** All-time aralıkları çözmek için takımın en erken event zamanı. */
public interface EarliestTimestampSource {

    Optional<Instant> earliestTimestamp(long teamId);
}
