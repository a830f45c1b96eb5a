package com.wayfarer.server.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfarer.common.constant.MediaStatusConstant;
import com.wayfarer.common.constant.RedisConstants;
import com.wayfarer.common.exception.BaseException;
import com.wayfarer.common.result.ErrorCode;
import com.wayfarer.pojo.dto.ItinerarySaveDTO;
import com.wayfarer.pojo.entity.Itinerary;
import com.wayfarer.pojo.vo.DayPlanVO;
import com.wayfarer.pojo.vo.ItineraryVO;
import com.wayfarer.pojo.vo.TripPlanVO;
import com.wayfarer.server.mapper.ItineraryMapper;
import com.wayfarer.server.media.MediaAssets;
import com.wayfarer.server.media.MediaTaskRecord;
import com.wayfarer.server.media.MediaTaskStatus;
import com.wayfarer.server.media.MediaTaskStore;
import com.wayfarer.server.service.ItineraryService;
import com.wayfarer.server.utils.CacheClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Service
@RequiredArgsConstructor
@Slf4j
public class ItineraryServiceImpl extends ServiceImpl<ItineraryMapper, Itinerary> implements ItineraryService {

    private final MediaTaskStore mediaTaskStore;
    private final CacheClient cacheClient;
    private final ObjectMapper objectMapper;

    @Override
    public ItineraryVO saveItinerary(Long userId, ItinerarySaveDTO dto) {
        if (userId == null) {
            throw new BaseException(ErrorCode.NOT_LOGGED_IN);
        }
        if (dto == null || dto.getPlan() == null) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "plan is required");
        }
        TripPlanVO plan = dto.getPlan();

        Itinerary itinerary = new Itinerary();
        itinerary.setUserId(userId);
        itinerary.setDestination(dto.getDestination());
        itinerary.setTitle(StringUtils.hasText(plan.getTitle())
                ? plan.getTitle()
                : "Trip to " + (StringUtils.hasText(dto.getDestination()) ? dto.getDestination() : "somewhere"));
        itinerary.setStartDate(dayDate(plan, true));
        itinerary.setEndDate(dayDate(plan, false));
        try {
            itinerary.setPlanJson(objectMapper.writeValueAsString(plan));
        } catch (JsonProcessingException e) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "plan cannot be serialized", e);
        }

        String taskId = StringUtils.hasText(dto.getMediaTaskId()) ? dto.getMediaTaskId().trim() : null;
        itinerary.setMediaTaskId(taskId);
        boolean terminalBeforeInsert = false;
        if (taskId == null) {
            itinerary.setMediaStatus(MediaStatusConstant.PENDING);
        } else {
            MediaTaskRecord record = mediaTaskStore.get(taskId);
            applyMedia(itinerary, record);
            terminalBeforeInsert = isTerminal(record);
        }
        LocalDateTime now = LocalDateTime.now();
        itinerary.setCreateTime(now);
        itinerary.setUpdateTime(now);
        save(itinerary);

        // 插入期间任务可能刚好结束，此时后台回写会落空，这里补一次
        if (taskId != null && !terminalBeforeInsert) {
            MediaTaskRecord latest = mediaTaskStore.get(taskId);
            if (isTerminal(latest)) {
                log.info("保存行程期间媒体任务已结束，补做回写: taskId={}, status={}", taskId, latest.getStatus());
                syncMediaByTaskId(taskId, latest);
                applyMedia(itinerary, latest);
            }
        }

        rememberPlan(userId, plan);
        log.info("行程已保存: userId={}, itineraryId={}, mediaTaskId={}, mediaStatus={}",
                userId, itinerary.getId(), taskId, itinerary.getMediaStatus());
        return toVO(itinerary);
    }

    @Override
    public int syncMediaByTaskId(String taskId, MediaTaskRecord record) {
        if (!StringUtils.hasText(taskId) || !isTerminal(record)) {
            return 0;
        }
        MediaAssets assets = record.getResult();
        int rows = getBaseMapper().updateMediaByTaskId(
                taskId,
                record.getStatus().getCode(),
                assets == null ? null : assets.getPosterUrl(),
                assets == null ? null : assets.getVideoUrl());
        if (rows == 0) {
            log.info("没有关联该媒体任务的行程，跳过回写: taskId={}", taskId);
        } else {
            log.info("行程媒体状态已回写: taskId={}, status={}, rows={}", taskId, record.getStatus(), rows);
        }
        return rows;
    }

    @Override
    public TripPlanVO latestPlan(Long userId) {
        if (userId == null) {
            throw new BaseException(ErrorCode.NOT_LOGGED_IN);
        }
        return cacheClient.queryWithPassThrough(
                RedisConstants.CACHE_PLAN_KEY,
                userId,
                TripPlanVO.class,
                this::loadLatestSavedPlan,
                RedisConstants.CACHE_PLAN_TTL_MINUTES,
                TimeUnit.MINUTES,
                RedisConstants.CACHE_NULL_TTL);
    }

    @Override
    public void rememberPlan(Long userId, TripPlanVO plan) {
        if (userId == null || plan == null) {
            return;
        }
        cacheClient.set(RedisConstants.CACHE_PLAN_KEY + userId, plan,
                RedisConstants.CACHE_PLAN_TTL_MINUTES, TimeUnit.MINUTES);
    }

    private TripPlanVO loadLatestSavedPlan(Long userId) {
        Itinerary latest = getBaseMapper().selectLatestByUserId(userId);
        if (latest == null || !StringUtils.hasText(latest.getPlanJson())) {
            return null;
        }
        try {
            return objectMapper.readValue(latest.getPlanJson(), TripPlanVO.class);
        } catch (JsonProcessingException e) {
            log.warn("行程 plan_json 无法解析: itineraryId={}, err={}", latest.getId(), e.getMessage());
            return null;
        }
    }

    private void applyMedia(Itinerary itinerary, MediaTaskRecord record) {
        MediaTaskStatus status = record == null ? null : record.getStatus();
        if (status == MediaTaskStatus.COMPLETED) {
            MediaAssets assets = record.getResult();
            itinerary.setMediaStatus(MediaStatusConstant.COMPLETED);
            if (assets != null) {
                itinerary.setPosterUrl(assets.getPosterUrl());
                itinerary.setVideoUrl(assets.getVideoUrl());
            }
        } else if (status == MediaTaskStatus.FAILED) {
            itinerary.setMediaStatus(MediaStatusConstant.FAILED);
        } else {
            itinerary.setMediaStatus(MediaStatusConstant.GENERATING);
        }
    }

    private static boolean isTerminal(MediaTaskRecord record) {
        return record != null && record.getStatus() != null && record.getStatus().isTerminal();
    }

    private static LocalDate dayDate(TripPlanVO plan, boolean first) {
        List<DayPlanVO> days = plan.getDays();
        if (days == null || days.isEmpty()) {
            return null;
        }
        DayPlanVO day = first ? days.get(0) : days.get(days.size() - 1);
        if (day == null || !StringUtils.hasText(day.getDate())) {
            return null;
        }
        try {
            return LocalDate.parse(day.getDate().trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private ItineraryVO toVO(Itinerary itinerary) {
        ItineraryVO vo = new ItineraryVO();
        vo.setId(itinerary.getId());
        vo.setTitle(itinerary.getTitle());
        vo.setDestination(itinerary.getDestination());
        vo.setMediaTaskId(itinerary.getMediaTaskId());
        vo.setMediaStatus(itinerary.getMediaStatus());
        vo.setPosterUrl(itinerary.getPosterUrl());
        vo.setVideoUrl(itinerary.getVideoUrl());
        return vo;
    }
}
