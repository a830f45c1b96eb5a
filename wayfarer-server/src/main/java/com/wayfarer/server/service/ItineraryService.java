package com.wayfarer.server.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wayfarer.pojo.dto.ItinerarySaveDTO;
import com.wayfarer.pojo.entity.Itinerary;
import com.wayfarer.pojo.vo.ItineraryVO;
import com.wayfarer.pojo.vo.TripPlanVO;
import com.wayfarer.server.media.MediaTaskRecord;

public interface ItineraryService extends IService<Itinerary> {

    /**
     * 保存行程，并按关联媒体任务的当前状态初始化 media_status。
     * 插入后会再读一次任务记录，任务在此期间结束时补做一次回写。
     */
    ItineraryVO saveItinerary(Long userId, ItinerarySaveDTO dto);

    /**
     * 媒体任务到达终态后回写关联行程；非终态记录不处理。
     *
     * @return 受影响行数
     */
    int syncMediaByTaskId(String taskId, MediaTaskRecord record);

    /**
     * 用户最近一次行程方案：先读方案缓存，未命中回源到最近保存的行程。
     */
    TripPlanVO latestPlan(Long userId);

    /**
     * 写入方案缓存，失败只记日志。
     */
    void rememberPlan(Long userId, TripPlanVO plan);
}
