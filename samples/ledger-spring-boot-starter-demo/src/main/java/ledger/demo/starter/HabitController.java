package ledger.demo.starter;

import ledger.ErrorKind;
import ledger.Result;
import ledger.command.CommandBus;
import ledger.habit.Plan;
import ledger.habit.PlanRepository;
import ledger.habit.command.CompleteHabitCommand;
import ledger.habit.command.CreateHabitCommand;
import ledger.habit.query.GetHabitAnalyticsQuery;
import ledger.habit.query.GetHabitsByUserQuery;
import ledger.habit.query.HabitView;
import ledger.habit.query.Page;
import ledger.habit.query.UserAnalyticsView;
import ledger.model.ProjectionStatus;
import ledger.projection.ProjectionManager;
import ledger.query.QueryBus;
import ledger.query.QueryException;
import ledger.query.QueryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

@RestController
public class HabitController {

    private static final Logger log = LoggerFactory.getLogger(HabitController.class);

    private final CommandBus commandBus;
    private final QueryBus queryBus;
    private final PlanRepository plans;
    private final ProjectionManager projectionManager;

    public HabitController(CommandBus commandBus, QueryBus queryBus, PlanRepository plans,
                           ProjectionManager projectionManager) {
        this.commandBus = commandBus;
        this.queryBus = queryBus;
        this.plans = plans;
        this.projectionManager = projectionManager;
    }

    @PostMapping("/plans")
    public ResponseEntity<Map<String, Object>> createPlan(@RequestParam String userId, @RequestParam String title) {
        Plan plan = new Plan(UUID.randomUUID().toString(), userId, title, Clock.systemUTC().instant());
        return respond(plans.create(plan).map(Plan::id), "planId");
    }

    @PostMapping("/habits")
    public ResponseEntity<Map<String, Object>> createHabit(@RequestParam String userId,
                                                           @RequestParam String planId,
                                                           @RequestParam String title) {
        return respond(commandBus.dispatch(new CreateHabitCommand(userId, planId, title, null)), "habitId");
    }

    @PostMapping("/habits/{habitId}/complete")
    public ResponseEntity<Map<String, Object>> completeHabit(
            @PathVariable String habitId,
            @RequestParam String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return respond(commandBus.dispatch(new CompleteHabitCommand(userId, habitId, date)), "habitId", habitId);
    }

    @GetMapping("/users/{userId}/habits")
    public Page<HabitView> habits(@PathVariable String userId) {
        return queryBus.dispatch(new GetHabitsByUserQuery(userId), QueryOptions.cached());
    }

    @GetMapping("/users/{userId}/analytics")
    public UserAnalyticsView analytics(@PathVariable String userId) {
        return queryBus.dispatch(new GetHabitAnalyticsQuery(userId), QueryOptions.cached());
    }

    @GetMapping("/projections")
    public ProjectionStatus projections() {
        return projectionManager.getProjectionStatus();
    }

    @ExceptionHandler(QueryException.class)
    public ResponseEntity<Map<String, Object>> queryFailed(QueryException e) {
        return ResponseEntity.status(statusOf(e.kind()))
                .body(Map.of("status", "error", "kind", e.kind().name(), "message", e.getMessage()));
    }

    private static ResponseEntity<Map<String, Object>> respond(Result<?> result, String idName) {
        return respond(result, idName, null);
    }

    private static ResponseEntity<Map<String, Object>> respond(Result<?> result, String idName, String id) {
        if (result instanceof Result.Err<?> err) {
            log.warn("Request failed: {} {}", err.kind(), err.message());
            return ResponseEntity.status(statusOf(err.kind()))
                    .body(Map.of("status", "error", "kind", err.kind().name(), "message", err.message()));
        }
        Object value = id != null ? id : result.orElseThrow();
        return ResponseEntity.ok(Map.of("status", "ok", idName, value));
    }

    private static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case CONFLICT -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
