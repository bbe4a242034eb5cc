package com.agentrelay.gateway.policy;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps a proposed automation action to a {@link ToolRiskTier}.
 *
 * <p>
 * Stateless and total: unknown tools, null names and null arguments all classify without
 * throwing.
 * </p>
 */
public final class ToolRiskClassifier {

    private ToolRiskClassifier() {
    }

    private static final Set<String> SHELL_TOOLS = Set.of("Bash", "bash", "shell", "exec");

    private static final Set<String> SCHEDULING_TOOLS = Set.of("schedule_recurring", "schedule_cron");

    private static final String MESSAGE_TOOL = "message";

    /** Prefix of tools served by an MCP server: {@code mcp__<server>__<tool>}. */
    private static final Pattern MCP_PREFIX = Pattern.compile("^mcp__.+?__");

    private static final List<Pattern> DESTRUCTIVE_PATTERNS = List.of(
            Pattern.compile("rm\\s+-rf\\s+/"),
            Pattern.compile("rm\\s+-rf\\s+~"),
            Pattern.compile("rm\\s+-rf\\s+\\.\\./"),
            Pattern.compile("mkfs\\."),
            Pattern.compile("dd\\s+if="),
            Pattern.compile(">\\s*/dev/sd"),
            Pattern.compile("curl\\s+.*\\|\\s*(ba)?sh"),
            Pattern.compile("wget\\s+.*\\|\\s*(ba)?sh"),
            Pattern.compile("chmod\\s+(-R\\s+)?777"),
            Pattern.compile(":\\(\\)\\s*\\{\\s*:\\|:&\\s*\\};:"),
            Pattern.compile("\\b(shutdown|reboot|halt)\\b"),
            Pattern.compile("launchctl\\s+unload"),
            Pattern.compile("defaults\\s+delete"),
            Pattern.compile("find\\s+/\\s+-delete"),
            Pattern.compile(">\\s*/dev/null\\s*2>&1\\s*&"),
            Pattern.compile("csrutil\\s+disable"),
            Pattern.compile("spctl\\s+--master-disable"),
            Pattern.compile("setenforce\\s+0"));

    /**
     * Classify one proposed action.
     *
     * @param toolName action name as reported by the backend (nullable)
     * @param args     structured arguments (nullable)
     */
    public static ToolRiskTier classify(String toolName, Map<String, Object> args) {
        if (toolName == null) {
            return ToolRiskTier.AUTO_ALLOW;
        }
        if (SHELL_TOOLS.contains(toolName)) {
            return classifyCommand(stringArg(args, "command"));
        }
        String bare = stripMcpPrefix(toolName);
        if (SCHEDULING_TOOLS.contains(bare)) {
            return ToolRiskTier.NOTIFY;
        }
        if (MESSAGE_TOOL.equals(bare) && "send".equals(stringArg(args, "action"))) {
            return ToolRiskTier.NOTIFY;
        }
        return ToolRiskTier.AUTO_ALLOW;
    }

    /**
     * Scan a shell command line against the destructive pattern list.
     */
    public static ToolRiskTier classifyCommand(String command) {
        if (command == null || command.isEmpty()) {
            return ToolRiskTier.AUTO_ALLOW;
        }
        for (Pattern p : DESTRUCTIVE_PATTERNS) {
            if (p.matcher(command).find()) {
                return ToolRiskTier.REQUIRE_APPROVAL;
            }
        }
        return ToolRiskTier.AUTO_ALLOW;
    }

    public static String stripMcpPrefix(String toolName) {
        return MCP_PREFIX.matcher(toolName).replaceFirst("");
    }

    private static String stringArg(Map<String, Object> args, String name) {
        if (args == null) {
            return null;
        }
        Object v = args.get(name);
        return v instanceof String s ? s : null;
    }
}
