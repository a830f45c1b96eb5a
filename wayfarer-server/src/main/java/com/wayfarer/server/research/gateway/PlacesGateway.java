package com.wayfarer.server.research.gateway;

import java.util.List;
import java.util.Map;

/**
 * 地点 / 餐饮检索。
 */
public interface PlacesGateway {

    List<Map<String, Object>> searchPlaces(PlaceSearchArgs args);
}
