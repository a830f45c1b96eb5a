package com.wayfarer.server.research.gateway;

import java.util.List;
import java.util.Map;

/**
 * 酒店检索。
 */
public interface HotelSearchGateway {

    List<Map<String, Object>> searchHotels(HotelSearchArgs args);
}
