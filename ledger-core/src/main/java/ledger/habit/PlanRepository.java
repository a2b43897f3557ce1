package ledger.habit;

import ledger.Result;

import java.util.List;

/**
 * Storage for {@link Plan}s.
 */
public interface PlanRepository {

    Result<Plan> create(Plan plan);

    /**
     * Loads a plan.
     *
     * @return the plan, or {@code NOT_FOUND} with "Plan not found"
     */
    Result<Plan> findById(String planId);

    Result<List<Plan>> findByUserId(String userId);
}
