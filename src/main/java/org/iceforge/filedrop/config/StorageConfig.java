package org.iceforge.filedrop.config;

import org.iceforge.filedrop.cleanup.InactiveObjectCleaner;
import org.iceforge.filedrop.store.ObjectStore;
import org.iceforge.filedrop.traffic.TrafficLedger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StorageConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ObjectStore objectStore(FiledropProperties props) {
        return new ObjectStoreFactory().create(props.getStorage());
    }

    @Bean
    public InactiveObjectCleaner inactiveObjectCleaner(FiledropProperties props, Clock clock) {
        FiledropProperties.Cleanup c = props.getCleanup();
        return new InactiveObjectCleaner(c.inactivityPeriod(), c.interval(), clock);
    }

    @Bean(destroyMethod = "close")
    public TrafficLedger trafficLedger(FiledropProperties props, Clock clock) {
        FiledropProperties.Limits l = props.getLimits();
        return new TrafficLedger(l.getUploadBytes(), l.getDownloadBytes(), clock);
    }
}
