package org.iceforge.filedrop.config;

import org.iceforge.filedrop.cleanup.InactiveObjectCleaner;
import org.iceforge.filedrop.store.ObjectStore;
import org.iceforge.filedrop.traffic.TrafficLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Starts the inactivity cleanup and the traffic counter sweep with the application context and
 * stops both on shutdown. The two run on separate schedules and stop independently.
 */
@Component
public class BackgroundTasksLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(BackgroundTasksLifecycle.class);

    private final FiledropProperties props;
    private final ObjectStore store;
    private final InactiveObjectCleaner cleaner;
    private final TrafficLedger ledger;
    private volatile boolean running;

    public BackgroundTasksLifecycle(FiledropProperties props, ObjectStore store,
                                    InactiveObjectCleaner cleaner, TrafficLedger ledger) {
        this.props = Objects.requireNonNull(props, "props");
        this.store = Objects.requireNonNull(store, "store");
        this.cleaner = Objects.requireNonNull(cleaner, "cleaner");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    @Override
    public void start() {
        if (props.getCleanup().isEnabled()) {
            try {
                cleaner.initialize(store);
            } catch (RuntimeException e) {
                // The service can still serve requests without cleanup.
                log.error("Failed to initialize cleanup job", e);
            }
        } else {
            log.info("Cleanup job disabled");
        }
        ledger.startReclamation(props.getLimits().getReclaimInterval());
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        cleaner.stop();
        ledger.close();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 0;
    }
}
