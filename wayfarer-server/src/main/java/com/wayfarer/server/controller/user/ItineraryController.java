package com.wayfarer.server.controller.user;

import com.wayfarer.common.context.BaseContext;
import com.wayfarer.common.result.ErrorCode;
import com.wayfarer.common.result.Result;
import com.wayfarer.pojo.dto.ItinerarySaveDTO;
import com.wayfarer.pojo.vo.ItineraryVO;
import com.wayfarer.pojo.vo.TripPlanVO;
import com.wayfarer.server.service.ItineraryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;

@RestController
@RequestMapping("/user/travel/itineraries")
@RequiredArgsConstructor
public class ItineraryController {

    private final ItineraryService itineraryService;

    @PostMapping
    public Result<ItineraryVO> save(@Valid @RequestBody ItinerarySaveDTO dto) {
        Long userId = BaseContext.getCurrentId();
        if (userId == null) {
            return Result.error(ErrorCode.NOT_LOGGED_IN);
        }
        return Result.success(itineraryService.saveItinerary(userId, dto));
    }

    @GetMapping("/latest")
    public Result<TripPlanVO> latest() {
        Long userId = BaseContext.getCurrentId();
        if (userId == null) {
            return Result.error(ErrorCode.NOT_LOGGED_IN);
        }
        return Result.success(itineraryService.latestPlan(userId));
    }
}
