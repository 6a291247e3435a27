package com.pipeline.battery.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 工步号 → 工步ID 映射。
 * 在工步提交后一次性构建，之后不可变，可安全地在多个批次间共享。
 */
public final class StepMapping {

    private final Map<Integer, Long> ids;

    private StepMapping(Map<Integer, Long> ids) {
        this.ids = Collections.unmodifiableMap(ids);
    }

    /** 由已提交的工步构建映射，id为null的工步被忽略 */
    public static StepMapping of(Collection<Step> steps) {
        Map<Integer, Long> ids = new LinkedHashMap<>();
        for (Step step : steps) {
            if (step.getId() != null) {
                ids.put(step.getStepNumber(), step.getId());
            }
        }
        return new StepMapping(ids);
    }

    public static StepMapping of(Map<Integer, Long> ids) {
        Map<Integer, Long> copy = new LinkedHashMap<>();
        ids.forEach((number, id) -> {
            if (id != null) copy.put(number, id);
        });
        return new StepMapping(copy);
    }

    /** @return 工步ID；未映射时返回null */
    public Long stepIdFor(int stepNumber) {
        return ids.get(stepNumber);
    }

    public boolean contains(int stepNumber) {
        return ids.containsKey(stepNumber);
    }

    public Set<Integer> stepNumbers() {
        return ids.keySet();
    }

    public Collection<Long> stepIds() {
        return ids.values();
    }

    /** 返回selected中未被映射的工步号（升序） */
    public Set<Integer> missingFrom(Collection<Integer> selected) {
        Set<Integer> missing = new TreeSet<>(selected);
        missing.removeAll(ids.keySet());
        return missing;
    }

    public Map<Integer, Long> asMap() {
        return ids;
    }

    public int size() {
        return ids.size();
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    @Override
    public String toString() {
        return "StepMapping" + ids;
    }
}
