package com.aiinpocket.adwatch.service;

import com.aiinpocket.adwatch.exception.InvalidScheduleException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.quartz.CronExpression;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.TimeZone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronScheduleParserTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "*/5 * * * *     | 0 */5 * * * ?",
            "0 9 * * *       | 0 0 9 * * ?",
            "30 8 1 * *      | 0 30 8 1 * ?",
            "0 9 * * 1-5     | 0 0 9 ? * 2,3,4,5,6",
            "0 9 * * 0       | 0 0 9 ? * 1",
            "0 9 * * 7       | 0 0 9 ? * 1",
            "0 9 * * 6,0     | 0 0 9 ? * 1,7",
            "0 9 * * */2     | 0 0 9 ? * 1,3,5,7",
            "0 9 * * mon-fri | 0 0 9 ? * MON-FRI",
            "0 0/5 * * * ?   | 0 0/5 * * * ?"
    })
    void shouldTranslateToQuartzFormat(String unix, String quartz) {
        assertThat(CronScheduleParser.toQuartz(unix)).isEqualTo(quartz);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "not a cron", "* * *", "61 * * * *", "0 9 1 * 1", "0 9 * * 8", "0 9 * * 5-1", "0 0 0 1 1 ? 2001"})
    void shouldRejectInvalidSchedules(String schedule) {
        assertThatThrownBy(() -> CronScheduleParser.validate(schedule))
                .isInstanceOf(InvalidScheduleException.class);
    }

    @Test
    void shouldEvaluateInConfiguredZone() {
        TimeZone stockholm = TimeZone.getTimeZone(ZoneId.of("Europe/Stockholm"));
        CronExpression expression = CronScheduleParser.parse("0 9 * * *", stockholm);

        ZonedDateTime from = ZonedDateTime.of(2026, 1, 10, 7, 0, 0, 0, ZoneId.of("UTC"));
        Date next = expression.getNextValidTimeAfter(Date.from(from.toInstant()));

        // 09:00 斯德哥爾摩（冬令時間 UTC+1）= 08:00 UTC
        assertThat(next.toInstant()).isEqualTo(from.plusHours(1).toInstant());
    }
}
