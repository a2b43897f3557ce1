package ledger.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a ledger event handler.
 *
 * <p>The annotated bean must implement {@link ledger.EventHandler}. It is subscribed on the
 * ledger's event bus for every listed event type once all singletons are created.
 *
 * <pre>{@code
 * @Component
 * @LedgerEventHandler({"HabitCompleted", "HabitMilestoneReached"})
 * public class StreakNotifier implements EventHandler {
 *     public void handle(DomainEvent event) { ... }
 * }
 * }</pre>
 *
 * <p>Use {@code "*"} to receive every event type.
 *
 * @see LedgerEventHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface LedgerEventHandler {

    /**
     * Event types this handler subscribes to. At least one is required.
     */
    String[] value();
}
