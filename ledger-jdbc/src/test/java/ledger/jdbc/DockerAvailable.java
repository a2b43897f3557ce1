package ledger.jdbc;

import org.junit.jupiter.api.extension.ConditionEvaluationResult;
import org.junit.jupiter.api.extension.ExecutionCondition;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.testcontainers.DockerClientFactory;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Container tests run only where Testcontainers finds a Docker daemon; elsewhere they are
 * reported as skipped.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@ExtendWith(DockerAvailable.Condition.class)
@interface DockerAvailable {

    final class Condition implements ExecutionCondition {
        private static volatile Boolean available;

        @Override
        public ConditionEvaluationResult evaluateExecutionCondition(ExtensionContext context) {
            if (available == null) {
                available = DockerClientFactory.instance().isDockerAvailable();
            }
            return available
                    ? ConditionEvaluationResult.enabled("Docker daemon found")
                    : ConditionEvaluationResult.disabled("No Docker daemon, skipping container test");
        }
    }
}
