package ledger.demo.starter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot Starter demo: the starter wires the ledger on an embedded H2 database.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/ledger-spring-boot-starter-demo/pom.xml spring-boot:run
 *
 * <p>Endpoints:
 * POST /plans?userId=u1&amp;title=Mornings               - create a plan
 * POST /habits?userId=u1&amp;planId=...&amp;title=Read        - create a habit
 * POST /habits/{id}/complete?userId=u1[&amp;date=...]   - complete a habit
 * GET  /users/{userId}/habits                         - list habits
 * GET  /users/{userId}/analytics                      - analytics view (cached)
 * GET  /projections                                   - projection status
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
