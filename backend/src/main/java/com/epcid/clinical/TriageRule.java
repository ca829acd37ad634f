package com.epcid.clinical;

import com.epcid.dto.TriageDTO;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the triage cascade: when {@code matches} holds, the cascade stops
 * and answers with {@code level}, the reasons produced for the context and the
 * tier's fixed next steps.
 */
public final class TriageRule {

    private final String name;
    private final TriageDTO.Level level;
    private final Predicate<TriageContext> matches;
    private final Function<TriageContext, List<String>> reasons;
    private final List<String> nextSteps;

    public TriageRule(String name, TriageDTO.Level level, Predicate<TriageContext> matches,
                      Function<TriageContext, List<String>> reasons, List<String> nextSteps) {
        this.name = name;
        this.level = level;
        this.matches = matches;
        this.reasons = reasons;
        this.nextSteps = List.copyOf(nextSteps);
    }

    public String getName() {
        return name;
    }

    public TriageDTO.Level getLevel() {
        return level;
    }

    public boolean matches(TriageContext context) {
        return matches.test(context);
    }

    public TriageDTO.Result apply(TriageContext context) {
        return TriageDTO.Result.builder()
            .level(level)
            .rule(name)
            .reasons(reasons.apply(context))
            .nextSteps(nextSteps)
            .build();
    }

    @Override
    public String toString() {
        return name + " -> " + level;
    }
}
