package com.hivemind.core.spawn;

import com.hivemind.core.model.AgentLevel;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guesses the level of an agent from the free text describing it. Allowed to be wrong;
 * the validator's enforcement mode decides how much a wrong guess matters.
 * Checks, in order: explicit level mention, role keywords, model family, tool-style
 * agents, then falls back to L2.
 */
@Component
public class AgentLevelDetector {

    private static final Pattern EXPLICIT = Pattern.compile("\\b(?:l|level\\s*)([123])\\b");

    private static final Map<AgentLevel, Pattern> ROLE_PATTERNS = new LinkedHashMap<>();
    static {
        ROLE_PATTERNS.put(AgentLevel.L1, Pattern.compile("orchestrator|coordinator|manager"));
        ROLE_PATTERNS.put(AgentLevel.L2, Pattern.compile("specialist|expert|domain"));
        ROLE_PATTERNS.put(AgentLevel.L3, Pattern.compile("worker|helper|search|analy[sz]e|atomic"));
    }

    private static final Map<String, AgentLevel> MODEL_HINTS = new LinkedHashMap<>();
    static {
        MODEL_HINTS.put("haiku", AgentLevel.L3);
        MODEL_HINTS.put("sonnet", AgentLevel.L2);
        MODEL_HINTS.put("opus", AgentLevel.L1);
    }

    private static final Pattern TOOL_HINT = Pattern.compile("\\b(?:explore|bash)\\b");

    public LevelInference detect(String prompt, String description) {
        String combined = ((prompt == null ? "" : prompt) + " " + (description == null ? "" : description))
                .toLowerCase(Locale.ROOT);

        Matcher explicit = EXPLICIT.matcher(combined);
        if (explicit.find()) {
            AgentLevel level = AgentLevel.valueOf("L" + explicit.group(1));
            return new LevelInference(level, LevelInference.Basis.EXPLICIT_MENTION, explicit.group());
        }

        for (Map.Entry<AgentLevel, Pattern> entry : ROLE_PATTERNS.entrySet()) {
            Matcher m = entry.getValue().matcher(combined);
            if (m.find()) {
                return new LevelInference(entry.getKey(), LevelInference.Basis.ROLE_KEYWORD, m.group());
            }
        }

        for (Map.Entry<String, AgentLevel> entry : MODEL_HINTS.entrySet()) {
            if (combined.contains(entry.getKey())) {
                return new LevelInference(entry.getValue(), LevelInference.Basis.MODEL_HINT, entry.getKey());
            }
        }

        Matcher tool = TOOL_HINT.matcher(combined);
        if (tool.find()) {
            return new LevelInference(AgentLevel.L3, LevelInference.Basis.TOOL_HINT, tool.group());
        }

        return new LevelInference(AgentLevel.L2, LevelInference.Basis.DEFAULT, null);
    }
}
