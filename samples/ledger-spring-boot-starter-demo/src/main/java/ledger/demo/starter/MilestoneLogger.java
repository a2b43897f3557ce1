package ledger.demo.starter;

import ledger.EventHandler;
import ledger.model.DomainEvent;
import ledger.spring.boot.LedgerEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@LedgerEventHandler({"HabitMilestoneReached", "HabitStreakBroken"})
public class MilestoneLogger implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(MilestoneLogger.class);

    @Override
    public void handle(DomainEvent event) {
        log.info("[Handler] {} on habit {}: user={}, payload={}",
                event.eventType(), event.streamId(), event.metadata().userId(), event.payload());
    }
}
