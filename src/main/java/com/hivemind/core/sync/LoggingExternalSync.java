package com.hivemind.core.sync;

import com.hivemind.core.model.ProgressUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sync that only logs. Replaced by defining another {@link ExternalSync} bean.
 */
public class LoggingExternalSync implements ExternalSync {

    private static final Logger log = LoggerFactory.getLogger(LoggingExternalSync.class);

    @Override
    public void publish(ProgressUpdate update) {
        if (update.hasMilestone()) {
            log.info("[sync] {} milestone {}% ({}%, {})", update.node(), update.milestone(),
                    update.percentage(), update.status());
        } else {
            log.debug("[sync] {} at {}% ({})", update.node(), update.percentage(), update.status());
        }
    }
}
