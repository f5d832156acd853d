package io.castbus.spring.boot;

import io.castbus.AsyncEventHandler;
import io.castbus.EventBus;
import io.castbus.EventHandler;
import io.castbus.EventPayload;
import io.castbus.EventType;
import io.castbus.Subscription;
import io.castbus.event.CharacterEventTypes;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scans for beans annotated with {@link CastBusListener} and subscribes them to the
 * {@link EventBus}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see CastBusListener
 */
public class CastBusListenerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final EventBus bus;
    private final List<Subscription> subscriptions = new ArrayList<>();

    public CastBusListenerRegistrar(ListableBeanFactory beanFactory, EventBus bus) {
        this.beanFactory = beanFactory;
        this.bus = bus;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(CastBusListener.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            AsyncEventHandler<?> handler = asHandler(beanName, bean);

            CastBusListener annotation = bean.getClass().getAnnotation(CastBusListener.class);
            if (annotation == null) {
                // Proxy may hide annotation; try the target class
                annotation = AnnotationUtils.findAnnotation(bean.getClass(), CastBusListener.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @CastBusListener annotation on " + bean.getClass().getName());
            }

            String name = annotation.eventType();
            EventType<?> type = CharacterEventTypes.find(name).orElseThrow(() ->
                    new BeanCreationException(beanName, "@CastBusListener names unknown event type '" + name + "'"));

            subscriptions.add(subscribe(type, handler, annotation));
        }
    }

    /**
     * Returns the subscriptions created for annotated beans.
     *
     * @return the subscriptions in registration order
     */
    public List<Subscription> subscriptions() {
        return List.copyOf(subscriptions);
    }

    private static AsyncEventHandler<?> asHandler(String beanName, Object bean) {
        if (bean instanceof AsyncEventHandler<?> async) {
            return async;
        }
        if (bean instanceof EventHandler<?> sync) {
            return AsyncEventHandler.of(sync);
        }
        throw new BeanCreationException(beanName,
                "Bean annotated with @CastBusListener must implement EventHandler or AsyncEventHandler, " +
                        "but " + bean.getClass().getName() + " does not");
    }

    @SuppressWarnings("unchecked")
    private <P extends EventPayload> Subscription subscribe(
            EventType<P> type, AsyncEventHandler<?> handler, CastBusListener annotation) {
        return bus.subscribe(type, (AsyncEventHandler<P>) handler, annotation.once(), annotation.priority());
    }
}
