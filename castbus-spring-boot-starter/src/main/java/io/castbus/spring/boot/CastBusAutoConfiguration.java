package io.castbus.spring.boot;

import io.castbus.EventBus;
import io.castbus.Registration;
import io.castbus.dispatch.DefaultEventBus;
import io.castbus.dispatch.EventInterceptor;
import io.castbus.handler.CharacterChangeHandler;
import io.castbus.handler.RelationshipChangeHandler;
import io.castbus.handler.RelationshipGraphProjector;
import io.castbus.registry.DefaultSubscriptionRegistry;
import io.castbus.registry.SubscriptionRegistry;
import io.castbus.service.RelationshipService;
import io.castbus.spi.BusMetrics;
import io.castbus.spi.CharacterStore;
import io.castbus.spi.RelationshipStore;
import io.castbus.store.InMemoryStoryStore;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the character event bus.
 *
 * <p>Builds the single {@link DefaultEventBus} of the application context from
 * {@link CastBusProperties}, falls back to an {@link InMemoryStoryStore} when no
 * {@link RelationshipStore} bean exists, subscribes both cascades, and exposes a
 * {@link RelationshipService}.
 *
 * @see CastBusProperties
 * @see CastBusMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(DefaultEventBus.class)
@EnableConfigurationProperties(CastBusProperties.class)
public class CastBusAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public SubscriptionRegistry subscriptionRegistry() {
    return new DefaultSubscriptionRegistry();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(EventBus.class)
  public DefaultEventBus eventBus(CastBusProperties props,
      SubscriptionRegistry subscriptionRegistry,
      ObjectProvider<BusMetrics> metricsProvider,
      ObjectProvider<EventInterceptor> interceptorProvider) {

    var loop = props.getLoopDetection();
    var builder = DefaultEventBus.builder()
        .registry(subscriptionRegistry)
        .loopThreshold(loop.getThreshold())
        .loopWindow(loop.getWindow())
        .strict(loop.isStrict())
        .drainTimeoutMs(props.getDispatch().getDrainTimeoutMs());
    BusMetrics metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    interceptorProvider.orderedStream().forEach(builder::interceptor);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean(RelationshipStore.class)
  public InMemoryStoryStore storyStore() {
    return new InMemoryStoryStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public RelationshipGraphProjector relationshipGraphProjector(RelationshipStore relationshipStore) {
    return new RelationshipGraphProjector(relationshipStore);
  }

  @Bean
  @ConditionalOnMissingBean
  public CharacterChangeHandler characterChangeHandler(EventBus eventBus) {
    return new CharacterChangeHandler(eventBus);
  }

  @Bean
  @ConditionalOnMissingBean
  public RelationshipChangeHandler relationshipChangeHandler(CastBusProperties props,
      RelationshipStore relationshipStore, EventBus eventBus, RelationshipGraphProjector projector) {
    var rel = props.getRelationships();
    return new RelationshipChangeHandler(relationshipStore, eventBus, projector,
        new RelationshipChangeHandler.Options(
            rel.isAutoSave(), rel.isUpdateMutualRelationships(), rel.getMutualStrengthFactor()));
  }

  @Bean(destroyMethod = "close")
  public Registration characterChangeRegistration(CharacterChangeHandler handler) {
    return handler.register();
  }

  @Bean(destroyMethod = "close")
  public Registration relationshipChangeRegistration(RelationshipChangeHandler handler) {
    return handler.register();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(CharacterStore.class)
  public RelationshipService relationshipService(CharacterStore characterStore,
      RelationshipStore relationshipStore, EventBus eventBus) {
    return new RelationshipService(characterStore, relationshipStore, eventBus);
  }

  @Bean
  @ConditionalOnMissingBean
  public CastBusListenerRegistrar castBusListenerRegistrar(ListableBeanFactory beanFactory, EventBus eventBus) {
    return new CastBusListenerRegistrar(beanFactory, eventBus);
  }
}
