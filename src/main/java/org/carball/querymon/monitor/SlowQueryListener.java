package org.carball.querymon.monitor;

import org.carball.querymon.model.query.SlowQueryLogEntry;

/**
 * Receives every slow query the monitor records. Called on the tracking thread, so
 * implementations must return quickly and must not perform blocking I/O.
 */
@FunctionalInterface
public interface SlowQueryListener {

    void onSlowQuery(SlowQueryLogEntry entry);
}
