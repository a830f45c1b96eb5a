package com.wayfarer.server.ai.profile;

import com.wayfarer.pojo.dto.TravelerProfileDTO;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * 画像合并规则：列表字段取并集（去重，保留首次出现顺序），标量字段后写覆盖。
 * 所有方法都返回新对象，不修改入参。
 */
public final class ProfileMerger {

    private ProfileMerger() {
    }

    public static TravelerProfileDTO merge(TravelerProfileDTO base, TravelerProfileDTO delta) {
        TravelerProfileDTO source = base == null ? TravelerProfileDTO.defaults() : base;
        TravelerProfileDTO merged = copy(source);
        if (delta == null) {
            return merged;
        }
        merged.setDietaryRestrictions(union(source.getDietaryRestrictions(), delta.getDietaryRestrictions()));
        merged.setReligiousRequirements(union(source.getReligiousRequirements(), delta.getReligiousRequirements()));
        merged.setAllergies(union(source.getAllergies(), delta.getAllergies()));
        merged.setAccessibilityNeeds(union(source.getAccessibilityNeeds(), delta.getAccessibilityNeeds()));
        merged.setInterests(union(source.getInterests(), delta.getInterests()));
        merged.setLanguagePreferences(union(source.getLanguagePreferences(), delta.getLanguagePreferences()));

        if (hasText(delta.getBudgetLevel())) {
            merged.setBudgetLevel(delta.getBudgetLevel().trim().toLowerCase());
        }
        if (hasText(delta.getTravelStyle())) {
            merged.setTravelStyle(delta.getTravelStyle().trim().toLowerCase());
        }
        if (delta.getGroupSize() != null && delta.getGroupSize() > 0) {
            merged.setGroupSize(delta.getGroupSize());
        }
        if (hasText(delta.getDestination())) {
            merged.setDestination(delta.getDestination().trim());
        }
        return merged;
    }

    public static TravelerProfileDTO copy(TravelerProfileDTO source) {
        TravelerProfileDTO target = new TravelerProfileDTO();
        target.setDietaryRestrictions(union(source.getDietaryRestrictions(), null));
        target.setReligiousRequirements(union(source.getReligiousRequirements(), null));
        target.setAllergies(union(source.getAllergies(), null));
        target.setAccessibilityNeeds(union(source.getAccessibilityNeeds(), null));
        target.setInterests(union(source.getInterests(), null));
        target.setLanguagePreferences(source.getLanguagePreferences() == null
                ? null : union(source.getLanguagePreferences(), null));
        target.setBudgetLevel(source.getBudgetLevel());
        target.setTravelStyle(source.getTravelStyle());
        target.setGroupSize(source.getGroupSize());
        target.setDestination(source.getDestination());
        target.fillDefaults();
        return target;
    }

    /**
     * 对比合并前后的画像，生成 "字段: 新值" 形式的变化摘要。
     */
    public static List<String> diff(TravelerProfileDTO before, TravelerProfileDTO after) {
        List<String> changes = new ArrayList<>();
        diffList(changes, "dietary_restrictions", before, after, TravelerProfileDTO::getDietaryRestrictions);
        diffList(changes, "religious_requirements", before, after, TravelerProfileDTO::getReligiousRequirements);
        diffList(changes, "allergies", before, after, TravelerProfileDTO::getAllergies);
        diffList(changes, "accessibility_needs", before, after, TravelerProfileDTO::getAccessibilityNeeds);
        diffList(changes, "interests", before, after, TravelerProfileDTO::getInterests);
        diffList(changes, "language_preferences", before, after, TravelerProfileDTO::getLanguagePreferences);
        diffScalar(changes, "budget_level", before.getBudgetLevel(), after.getBudgetLevel());
        diffScalar(changes, "travel_style", before.getTravelStyle(), after.getTravelStyle());
        diffScalar(changes, "group_size", before.getGroupSize(), after.getGroupSize());
        diffScalar(changes, "destination", before.getDestination(), after.getDestination());
        return changes;
    }

    private static List<String> union(List<String> base, List<String> extra) {
        LinkedHashSet<String> set = new LinkedHashSet<>();
        addAll(set, base);
        addAll(set, extra);
        return new ArrayList<>(set);
    }

    private static void addAll(LinkedHashSet<String> set, List<String> values) {
        if (values == null) {
            return;
        }
        for (String v : values) {
            if (hasText(v)) {
                set.add(v.trim());
            }
        }
    }

    private static void diffList(List<String> changes, String field,
                                 TravelerProfileDTO before, TravelerProfileDTO after,
                                 Function<TravelerProfileDTO, List<String>> getter) {
        List<String> old = getter.apply(before);
        List<String> now = getter.apply(after);
        if (now == null) {
            return;
        }
        for (String v : now) {
            if (old == null || !old.contains(v)) {
                changes.add(field + ": " + v);
            }
        }
    }

    private static void diffScalar(List<String> changes, String field, Object old, Object now) {
        if (now != null && !Objects.equals(old, now)) {
            changes.add(field + ": " + now);
        }
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
