package ledger.demo.starter;

import io.micrometer.core.instrument.MeterRegistry;
import ledger.jdbc.JdbcEventStore;
import ledger.spi.EventStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:ledger_demo_test;DB_CLOSE_DELAY=-1")
class ApplicationTest {

    @Autowired
    HabitController controller;

    @Autowired
    EventStore eventStore;

    @Autowired
    MeterRegistry meterRegistry;

    @Test
    void createAndCompleteHabitThroughTheStarter() {
        String planId = (String) controller.createPlan("u1", "Mornings").getBody().get("planId");
        String habitId = (String) controller.createHabit("u1", planId, "Read").getBody().get("habitId");
        ResponseEntity<Map<String, Object>> completed = controller.completeHabit(habitId, "u1", null);
        ResponseEntity<Map<String, Object>> again = controller.completeHabit(habitId, "u1", null);
        ResponseEntity<Map<String, Object>> missing = controller.completeHabit("nope", "u1", null);

        assertInstanceOf(JdbcEventStore.class, eventStore);
        assertEquals(HttpStatus.OK, completed.getStatusCode());
        assertEquals(HttpStatus.CONFLICT, again.getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
        assertEquals(2L, eventStore.getStreamVersion(habitId));
        assertEquals(1, controller.analytics("u1").journey().totalCompletions());
        assertEquals(1L, controller.habits("u1").total());
        assertTrue(controller.projections().running());
        assertNotNull(meterRegistry.find("ledger.command.success").counter());
    }
}
