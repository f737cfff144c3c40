package com.aiinpocket.adwatch.service;

import com.aiinpocket.adwatch.exception.InvalidScheduleException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.util.Date;
import java.util.TimeZone;
import java.util.TreeSet;

/**
 * 把監控器的排程字串轉成 Quartz {@link CronExpression}。
 *
 * <p>接受兩種寫法：
 * <ul>
 *   <li>5 欄位 Unix cron（分 時 日 月 星期），例如 {@code *}{@code /5 * * * *}。
 *       轉換時補上秒欄位 0、把沒用到的日 / 星期欄位換成 {@code ?}，
 *       並把數字星期從 Unix（0 或 7 = 週日）改成 Quartz（1 = 週日）。</li>
 *   <li>6 或 7 欄位的 Quartz 原生格式，直接交給 Quartz 驗證。</li>
 * </ul>
 * Unix 允許同時指定日期與星期（任一符合即觸發），Quartz 不支援，這種寫法直接拒絕。
 * 格式正確但之後不會再觸發的排程（例如指定過去年份）同樣視為無效。
 */
public final class CronScheduleParser {

    private CronScheduleParser() {
    }

    public static CronExpression parse(String schedule, TimeZone zone) {
        String quartz = toQuartz(schedule);
        CronExpression expression;
        try {
            expression = new CronExpression(quartz);
        } catch (ParseException e) {
            throw new InvalidScheduleException("排程格式不正確: " + schedule, e);
        }
        expression.setTimeZone(zone);
        if (expression.getNextValidTimeAfter(new Date()) == null) {
            throw new InvalidScheduleException("排程之後不會再觸發: " + schedule);
        }
        return expression;
    }

    public static void validate(String schedule) {
        parse(schedule, TimeZone.getDefault());
    }

    static String toQuartz(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new InvalidScheduleException("排程不能為空");
        }
        String[] fields = schedule.trim().split("\\s+");
        if (fields.length == 6 || fields.length == 7) {
            return String.join(" ", fields);
        }
        if (fields.length != 5) {
            throw new InvalidScheduleException("排程需為 5 欄位（Unix）或 6/7 欄位（Quartz）: " + schedule);
        }

        String dayOfMonth = fields[2];
        String dayOfWeek = fields[4];
        boolean anyDayOfMonth = isWildcard(dayOfMonth);
        boolean anyDayOfWeek = isWildcard(dayOfWeek);

        if (anyDayOfWeek) {
            dayOfMonth = anyDayOfMonth ? "*" : dayOfMonth;
            dayOfWeek = "?";
        } else if (anyDayOfMonth) {
            dayOfMonth = "?";
            dayOfWeek = convertDayOfWeek(dayOfWeek, schedule);
        } else {
            throw new InvalidScheduleException("不支援同時指定日期與星期: " + schedule);
        }

        return String.join(" ", "0", fields[0], fields[1], dayOfMonth, fields[3], dayOfWeek);
    }

    private static boolean isWildcard(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    /**
     * 數字星期展開成 Quartz 的逗號清單；含英文縮寫（MON-FRI）的欄位兩邊語意相同，原樣保留。
     */
    private static String convertDayOfWeek(String field, String schedule) {
        if (field.chars().anyMatch(Character::isLetter)) {
            return field.toUpperCase();
        }
        TreeSet<Integer> days = new TreeSet<>();
        for (String part : field.split(",")) {
            expandDayOfWeekPart(part, days, schedule);
        }
        StringBuilder result = new StringBuilder();
        for (int unixDay : days) {
            if (!result.isEmpty()) {
                result.append(',');
            }
            result.append(unixDay == 0 ? 1 : unixDay + 1);
        }
        return result.toString();
    }

    private static void expandDayOfWeekPart(String part, TreeSet<Integer> days, String schedule) {
        String range = part;
        int step = 1;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            range = part.substring(0, slash);
            step = parseDay(part.substring(slash + 1), schedule);
            if (step <= 0) {
                throw new InvalidScheduleException("星期欄位的間隔不正確: " + schedule);
            }
        }

        int from;
        int to;
        if ("*".equals(range)) {
            from = 0;
            to = 6;
        } else if (range.contains("-")) {
            String[] bounds = range.split("-", 2);
            from = parseDay(bounds[0], schedule);
            to = parseDay(bounds[1], schedule);
        } else {
            from = parseDay(range, schedule);
            to = slash >= 0 ? 6 : from;
        }
        if (from > to) {
            throw new InvalidScheduleException("星期範圍不正確: " + schedule);
        }
        for (int day = from; day <= to; day += step) {
            // Unix 的 7 也是週日
            days.add(day % 7);
        }
    }

    private static int parseDay(String value, String schedule) {
        try {
            int day = Integer.parseInt(value);
            if (day < 0 || day > 7) {
                throw new InvalidScheduleException("星期需介於 0-7: " + schedule);
            }
            return day;
        } catch (NumberFormatException e) {
            throw new InvalidScheduleException("星期欄位格式不正確: " + schedule, e);
        }
    }
}
