package com.wayfarer.pojo.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 旅行者画像。
 * Traveler profile, rebuilt from the caller-supplied context on every request.
 *
 * 列表字段在合并后按集合语义去重（保留首次出现顺序），标量字段后写覆盖。
 * 作为合并增量使用时，null 表示"本轮未提及"。
 * 同时兼容 LLM 输出的 snake_case 字段名。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TravelerProfileDTO {

    public static final String DEFAULT_BUDGET_LEVEL = "moderate";
    public static final String DEFAULT_TRAVEL_STYLE = "balanced";
    public static final int DEFAULT_GROUP_SIZE = 1;
    public static final String DEFAULT_LANGUAGE = "English";

    @JsonAlias("dietary_restrictions")
    private List<String> dietaryRestrictions;

    @JsonAlias("religious_requirements")
    private List<String> religiousRequirements;

    private List<String> allergies;

    @JsonAlias("accessibility_needs")
    private List<String> accessibilityNeeds;

    private List<String> interests;

    @JsonAlias("language_preferences")
    private List<String> languagePreferences;

    /**
     * budget / moderate / luxury
     */
    @JsonAlias("budget_level")
    private String budgetLevel;

    /**
     * 例如 relaxed / balanced / adventurous
     */
    @JsonAlias("travel_style")
    private String travelStyle;

    @JsonAlias("group_size")
    private Integer groupSize;

    private String destination;

    /**
     * 新访客的默认画像。
     */
    public static TravelerProfileDTO defaults() {
        TravelerProfileDTO profile = new TravelerProfileDTO();
        profile.fillDefaults();
        return profile;
    }

    /**
     * 只填充缺失字段，已有值保持不变。
     */
    public void fillDefaults() {
        if (dietaryRestrictions == null) {
            dietaryRestrictions = new ArrayList<>();
        }
        if (religiousRequirements == null) {
            religiousRequirements = new ArrayList<>();
        }
        if (allergies == null) {
            allergies = new ArrayList<>();
        }
        if (accessibilityNeeds == null) {
            accessibilityNeeds = new ArrayList<>();
        }
        if (interests == null) {
            interests = new ArrayList<>();
        }
        if (languagePreferences == null) {
            languagePreferences = new ArrayList<>(List.of(DEFAULT_LANGUAGE));
        }
        if (budgetLevel == null) {
            budgetLevel = DEFAULT_BUDGET_LEVEL;
        }
        if (travelStyle == null) {
            travelStyle = DEFAULT_TRAVEL_STYLE;
        }
        if (groupSize == null) {
            groupSize = DEFAULT_GROUP_SIZE;
        }
    }
}
