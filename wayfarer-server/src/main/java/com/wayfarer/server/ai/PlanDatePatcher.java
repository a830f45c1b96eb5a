package com.wayfarer.server.ai;

import com.wayfarer.pojo.vo.DayPlanVO;
import com.wayfarer.pojo.vo.TripPlanVO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * 行程日期回填：不管合成步骤给出了什么日期，第 i 天（从 0 计）一律改为 startDate + i，
 * dayNumber 重排为 1..N。
 */
@Slf4j
public final class PlanDatePatcher {

    private PlanDatePatcher() {
    }

    public static TripPlanVO patch(TripPlanVO plan, LocalDate startDate) {
        if (plan == null || plan.getDays() == null || startDate == null) {
            return plan;
        }
        for (int i = 0; i < plan.getDays().size(); i++) {
            DayPlanVO day = plan.getDays().get(i);
            if (day == null) {
                day = new DayPlanVO();
                plan.getDays().set(i, day);
            }
            day.setDayNumber(i + 1);
            day.setDate(startDate.plusDays(i).toString());
        }
        return plan;
    }

    /**
     * 从调用方上下文解析起始日期：支持 startDate 或 dates.start（yyyy-MM-dd），
     * 缺失、格式不对或无法再往后排 maxDays 天时使用 today + 1。
     */
    public static LocalDate resolveStartDate(Map<String, Object> context, LocalDate today, int maxDays) {
        String raw = null;
        if (context != null) {
            Object direct = context.get("startDate");
            if (direct == null && context.get("dates") instanceof Map) {
                direct = ((Map<?, ?>) context.get("dates")).get("start");
            }
            raw = direct == null ? null : String.valueOf(direct);
        }
        if (StringUtils.hasText(raw)) {
            try {
                LocalDate parsed = LocalDate.parse(raw.trim());
                if (!parsed.isAfter(LocalDate.MAX.minusDays(Math.max(1, maxDays)))) {
                    return parsed;
                }
                log.warn("起始日期超出可排期范围，使用默认值: startDate={}", raw);
            } catch (DateTimeParseException e) {
                log.warn("起始日期格式不正确，使用默认值: startDate={}", raw);
            }
        }
        return today.plusDays(1);
    }

    /**
     * 解析行程天数：支持 days 或 dates.start + dates.end，缺失时使用默认天数，结果不超过 maxDays。
     */
    public static int resolveDays(Map<String, Object> context, LocalDate startDate, int defaultDays, int maxDays) {
        int cap = Math.max(1, maxDays);
        if (context == null) {
            return Math.min(defaultDays, cap);
        }
        Object days = context.get("days");
        if (days instanceof Number && ((Number) days).longValue() > 0) {
            return (int) Math.min(((Number) days).longValue(), cap);
        }
        if (days instanceof String) {
            try {
                long parsed = Long.parseLong(((String) days).trim());
                if (parsed > 0) {
                    return (int) Math.min(parsed, cap);
                }
            } catch (NumberFormatException e) {
                log.warn("行程天数格式不正确，使用默认值: days={}", days);
            }
        }
        if (context.get("dates") instanceof Map) {
            Object end = ((Map<?, ?>) context.get("dates")).get("end");
            if (end != null && startDate != null) {
                try {
                    LocalDate endDate = LocalDate.parse(String.valueOf(end).trim());
                    long span = endDate.toEpochDay() - startDate.toEpochDay() + 1;
                    if (span > 0) {
                        return (int) Math.min(span, cap);
                    }
                } catch (DateTimeParseException e) {
                    log.warn("结束日期格式不正确，使用默认天数: end={}", end);
                }
            }
        }
        return Math.min(defaultDays, cap);
    }
}
