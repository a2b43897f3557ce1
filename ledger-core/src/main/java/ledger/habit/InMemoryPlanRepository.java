package ledger.habit;

import ledger.ErrorKind;
import ledger.Result;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link PlanRepository}.
 */
public final class InMemoryPlanRepository implements PlanRepository {
    static final String NOT_FOUND = "Plan not found";

    private final Map<String, Plan> plans = new ConcurrentHashMap<>();

    @Override
    public Result<Plan> create(Plan plan) {
        if (plans.putIfAbsent(plan.id(), plan) != null) {
            return Result.err(ErrorKind.CONFLICT, "Plan " + plan.id() + " already exists");
        }
        return Result.ok(plan);
    }

    @Override
    public Result<Plan> findById(String planId) {
        Plan plan = planId == null ? null : plans.get(planId);
        return plan == null ? Result.err(ErrorKind.NOT_FOUND, NOT_FOUND) : Result.ok(plan);
    }

    @Override
    public Result<List<Plan>> findByUserId(String userId) {
        List<Plan> result = new ArrayList<>();
        for (Plan plan : plans.values()) {
            if (plan.userId().equals(userId)) {
                result.add(plan);
            }
        }
        result.sort(Comparator.comparing(Plan::createdAt).thenComparing(Plan::id));
        return Result.ok(result);
    }
}
