package ledger.spring.boot;

import ledger.EventHandler;
import ledger.bus.EventBus;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link LedgerEventHandler} and subscribes them on the
 * {@link EventBus}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 */
public class LedgerEventHandlerRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(LedgerEventHandlerRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final EventBus eventBus;

    public LedgerEventHandlerRegistrar(ListableBeanFactory beanFactory, EventBus eventBus) {
        this.beanFactory = beanFactory;
        this.eventBus = eventBus;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(LedgerEventHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof EventHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @LedgerEventHandler must implement EventHandler, "
                                + "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation on the target class
            LedgerEventHandler annotation = AnnotationUtils.findAnnotation(bean.getClass(), LedgerEventHandler.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @LedgerEventHandler annotation on " + bean.getClass().getName());
            }
            if (annotation.value().length == 0) {
                throw new BeanCreationException(beanName,
                        "@LedgerEventHandler must name at least one event type");
            }

            for (String eventType : annotation.value()) {
                if (eventType.isBlank()) {
                    throw new BeanCreationException(beanName,
                            "@LedgerEventHandler event types must not be blank");
                }
                eventBus.subscribe(eventType, handler);
                logger.log(Level.FINE, "Subscribed bean {0} to {1}", new Object[]{beanName, eventType});
            }
        }
    }
}
