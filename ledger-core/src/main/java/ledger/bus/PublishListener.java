package ledger.bus;

import ledger.model.DomainEvent;

import java.util.List;

/**
 * Callback invoked once per successfully stored batch, after handlers have run.
 */
@FunctionalInterface
public interface PublishListener {

    void onPublished(List<DomainEvent> events);
}
