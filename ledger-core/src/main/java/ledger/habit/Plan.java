package ledger.habit;

import java.time.Instant;
import java.util.Objects;

/**
 * A user's plan that groups habits. Habits can only be created in a plan owned by the
 * same user.
 */
public record Plan(String id, String userId, String title, Instant createdAt) {
    public Plan {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
