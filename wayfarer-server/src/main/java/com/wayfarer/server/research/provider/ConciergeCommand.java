package com.wayfarer.server.research.provider;

import com.wayfarer.server.research.gateway.HotelSearchArgs;
import com.wayfarer.server.research.gateway.PlaceSearchArgs;
import lombok.Data;

/**
 * 礼宾调研的一次操作：工具 + 该工具对应的参数。
 * SEARCH_HOTELS 只携带 hotelArgs，SEARCH_PLACES / FALLBACK 只携带 placeArgs。
 */
@Data
public class ConciergeCommand {

    private ConciergeTool tool;

    private HotelSearchArgs hotelArgs;

    private PlaceSearchArgs placeArgs;

    /**
     * FALLBACK 的原因（推理失败、工具名未知等），仅用于日志。
     */
    private String fallbackReason;

    public static ConciergeCommand hotels(HotelSearchArgs args) {
        ConciergeCommand command = new ConciergeCommand();
        command.setTool(ConciergeTool.SEARCH_HOTELS);
        command.setHotelArgs(args == null ? new HotelSearchArgs() : args);
        return command;
    }

    public static ConciergeCommand places(PlaceSearchArgs args) {
        ConciergeCommand command = new ConciergeCommand();
        command.setTool(ConciergeTool.SEARCH_PLACES);
        command.setPlaceArgs(args == null ? new PlaceSearchArgs() : args);
        return command;
    }

    public static ConciergeCommand fallback(String reason) {
        ConciergeCommand command = new ConciergeCommand();
        command.setTool(ConciergeTool.FALLBACK);
        command.setPlaceArgs(new PlaceSearchArgs());
        command.setFallbackReason(reason);
        return command;
    }
}
