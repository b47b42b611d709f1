package com.fbo.reconciliation.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs every registered {@link HealthCheck} and folds the results into one status.
 *
 * <p>The aggregate takes the worst individual status (DOWN over DEGRADED over UP) and the
 * message of the check that produced it. Each check's result is attached as a detail under
 * the check's name.</p>
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        HealthStatus.Status worst = HealthStatus.Status.UP;
        String worstMessage = "OK";
        Map<String, Object> perCheck = new LinkedHashMap<>();

        for (HealthCheck check : checks) {
            HealthStatus result = check.check();
            perCheck.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            if (result.status().ordinal() > worst.ordinal()) {
                worst = result.status();
                worstMessage = check.getName() + ": " + result.message();
            }
        }
        return new HealthStatus(worst, worstMessage, perCheck);
    }

    public int size() {
        return checks.size();
    }
}
