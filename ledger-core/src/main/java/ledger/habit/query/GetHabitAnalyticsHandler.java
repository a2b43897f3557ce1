package ledger.habit.query;

import ledger.habit.projection.HabitAnalyticsProjection;
import ledger.habit.projection.UserJourney;
import ledger.query.QueryHandler;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Serves a user's analytics from {@link HabitAnalyticsProjection}. The view is as fresh as
 * the projection's checkpoint.
 */
public final class GetHabitAnalyticsHandler implements QueryHandler<GetHabitAnalyticsQuery, UserAnalyticsView> {
    private static final int RECENT_DAYS = 30;

    private final HabitAnalyticsProjection projection;
    private final Clock clock;

    public GetHabitAnalyticsHandler(HabitAnalyticsProjection projection, Clock clock) {
        this.projection = Objects.requireNonNull(projection, "projection");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public UserAnalyticsView handle(GetHabitAnalyticsQuery query) {
        HabitQuerySupport.requireUser(query.userId());
        UserJourney journey = projection.journey(query.userId()).orElse(UserJourney.start(query.userId()));
        LocalDate today = LocalDate.now(clock);
        return new UserAnalyticsView(journey, journey.growthScore(), projection.habitStatsForUser(query.userId()),
                projection.dailyStats(query.userId(), today.minusDays(RECENT_DAYS - 1), today));
    }
}
