package reconciler.jdbc;

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
 * Disables container-backed tests on machines without a Docker daemon. The probe runs once
 * per JVM.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@ExtendWith(DockerAvailable.Probe.class)
@interface DockerAvailable {

  final class Probe implements ExecutionCondition {
    private static volatile ConditionEvaluationResult cached;

    @Override
    public ConditionEvaluationResult evaluateExecutionCondition(ExtensionContext context) {
      ConditionEvaluationResult result = cached;
      if (result == null) {
        result = probe();
        cached = result;
      }
      return result;
    }

    private static ConditionEvaluationResult probe() {
      try {
        boolean ok = DockerClientFactory.instance().isDockerAvailable();
        return ok
            ? ConditionEvaluationResult.enabled("docker daemon reachable")
            : ConditionEvaluationResult.disabled("docker daemon not reachable");
      } catch (Throwable t) {
        return ConditionEvaluationResult.disabled("docker probe failed: " + t.getMessage());
      }
    }
  }
}
