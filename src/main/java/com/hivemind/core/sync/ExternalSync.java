package com.hivemind.core.sync;

import com.hivemind.core.model.ProgressUpdate;

/**
 * Outbound port to an external issue tracker or dashboard.
 * <p>
 * Called after the change is committed. Implementations may throw; the failure is
 * logged and counted, and the committed progress is never rolled back.
 */
public interface ExternalSync {

    void publish(ProgressUpdate update);
}
