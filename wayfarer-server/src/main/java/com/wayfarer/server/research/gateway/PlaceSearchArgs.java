package com.wayfarer.server.research.gateway;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * 地点检索参数。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlaceSearchArgs {

    /** 例如 "halal restaurants in Lisbon" */
    private String query;

    private String location;

    /** 价格等级 0~4，空表示不限 */
    @JsonAlias("price_levels")
    private List<Integer> priceLevels;

    @JsonAlias("min_rating")
    private Double minRating;
}
