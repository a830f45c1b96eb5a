package com.wayfarer.server.research.gateway;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * 酒店检索参数。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class HotelSearchArgs {

    private String location;

    /** yyyy-MM-dd，可为空 */
    @JsonAlias("check_in")
    private String checkIn;

    @JsonAlias("check_out")
    private String checkOut;

    private Integer guests;

    @JsonAlias("price_levels")
    private List<Integer> priceLevels;

    /** 例如 wheelchair accessible、halal breakfast */
    private List<String> amenities;
}
