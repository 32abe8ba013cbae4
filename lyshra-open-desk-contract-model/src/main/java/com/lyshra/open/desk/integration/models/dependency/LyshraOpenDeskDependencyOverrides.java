package com.lyshra.open.desk.integration.models.dependency;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Field name to dependency state, for the fields that declare at least one dependency expression.
 */
@ToString
@EqualsAndHashCode
public class LyshraOpenDeskDependencyOverrides {
    private static final LyshraOpenDeskDependencyOverrides EMPTY = new LyshraOpenDeskDependencyOverrides(Map.of());

    private final Map<String, LyshraOpenDeskFieldDependencyState> states;

    public LyshraOpenDeskDependencyOverrides(Map<String, LyshraOpenDeskFieldDependencyState> states) {
        this.states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    public static LyshraOpenDeskDependencyOverrides empty() {
        return EMPTY;
    }

    public Map<String, LyshraOpenDeskFieldDependencyState> asMap() {
        return states;
    }

    public Optional<LyshraOpenDeskFieldDependencyState> get(String fieldName) {
        return Optional.ofNullable(states.get(fieldName));
    }

    public boolean isHiddenByDependency(String fieldName) {
        return get(fieldName).flatMap(LyshraOpenDeskFieldDependencyState::getHiddenByDependency).orElse(false);
    }

    public boolean isDynamicallyRequired(String fieldName) {
        return get(fieldName).flatMap(LyshraOpenDeskFieldDependencyState::getDynamicallyRequired).orElse(false);
    }

    public Optional<Boolean> getDynamicallyReadOnly(String fieldName) {
        return get(fieldName).flatMap(LyshraOpenDeskFieldDependencyState::getDynamicallyReadOnly);
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    public int size() {
        return states.size();
    }
}
