package io.syncevents.spring.boot;

import io.syncevents.SyncClient;
import io.syncevents.event.EventKind;
import io.syncevents.event.EventTypeTable;
import io.syncevents.room.InMemoryRoomDirectory;
import io.syncevents.spi.DispatchMetrics;
import io.syncevents.spi.RoomProvider;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Map;

/**
 * Auto-configuration for the sync event dispatcher.
 *
 * <p>Wires up a {@link SyncClient} from {@link SyncEventsProperties}, a
 * {@link RoomProvider} (an {@link InMemoryRoomDirectory} unless the application
 * defines one) and an optional {@link DispatchMetrics} bean. Bean methods
 * annotated with {@link SyncEventHandler} are registered once all singletons exist.
 *
 * @see SyncEventsProperties
 * @see SyncEventsMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(SyncClient.class)
@EnableConfigurationProperties(SyncEventsProperties.class)
public class SyncEventsAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(RoomProvider.class)
  public InMemoryRoomDirectory roomDirectory() {
    return new InMemoryRoomDirectory();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventTypeTable eventTypeTable(SyncEventsProperties props) {
    EventTypeTable.Builder builder = EventTypeTable.builder().defaults();
    for (Map.Entry<EventKind, List<String>> entry : props.getEventTypes().entrySet()) {
      for (String type : entry.getValue()) {
        builder.add(entry.getKey(), type);
      }
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public SyncClient syncClient(SyncEventsProperties props,
      RoomProvider roomProvider,
      EventTypeTable eventTypeTable,
      ObjectProvider<DispatchMetrics> metricsProvider) {
    var builder = SyncClient.builder()
        .roomProvider(roomProvider)
        .eventTypes(eventTypeTable)
        .slowHandlerThreshold(props.getDispatch().getSlowHandlerThreshold());
    DispatchMetrics metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public SyncEventHandlerRegistrar syncEventHandlerRegistrar(
      ListableBeanFactory beanFactory, SyncClient syncClient) {
    return new SyncEventHandlerRegistrar(beanFactory, syncClient);
  }
}
