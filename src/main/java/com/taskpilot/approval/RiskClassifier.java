package com.taskpilot.approval;

import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Static mapping from tool name to risk tier. The tier never depends on the parameters
 * of a call. Tools missing from the table are {@link RiskTier#LOW}.
 */
public final class RiskClassifier {

    private static final Map<String, RiskTier> RISK_TABLE = Map.of(
            "write_file", RiskTier.HIGH,
            "delete_file", RiskTier.HIGH,
            "run_command", RiskTier.HIGH,
            "create_file", RiskTier.HIGH,
            "update_package_json", RiskTier.MEDIUM,
            "init_project", RiskTier.MEDIUM
    );

    private RiskClassifier() {
    }

    public static RiskTier classify(String toolName) {
        if (!StringUtils.hasText(toolName)) {
            return RiskTier.LOW;
        }
        return RISK_TABLE.getOrDefault(toolName, RiskTier.LOW);
    }
}
