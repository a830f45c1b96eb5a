package com.wayfarer.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wayfarer.pojo.entity.Itinerary;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface ItineraryMapper extends BaseMapper<Itinerary> {

    /**
     * 媒体任务结束后按 media_task_id 回写状态与产物地址，重复执行结果相同。
     *
     * @return 受影响行数，可能为 0（用户尚未保存行程）
     */
    @Update("UPDATE itinerary SET media_status = #{mediaStatus}, poster_url = #{posterUrl}, "
            + "video_url = #{videoUrl}, update_time = NOW() WHERE media_task_id = #{mediaTaskId}")
    int updateMediaByTaskId(@Param("mediaTaskId") String mediaTaskId,
                            @Param("mediaStatus") String mediaStatus,
                            @Param("posterUrl") String posterUrl,
                            @Param("videoUrl") String videoUrl);

    @Select("SELECT * FROM itinerary WHERE user_id = #{userId} ORDER BY id DESC LIMIT 1")
    Itinerary selectLatestByUserId(@Param("userId") Long userId);
}
