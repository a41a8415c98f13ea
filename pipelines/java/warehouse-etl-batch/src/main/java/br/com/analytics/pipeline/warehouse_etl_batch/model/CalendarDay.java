package br.com.analytics.pipeline.warehouse_etl_batch.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;

/**
 * One day of the calendar dimension. {@code idTempo} is the date written as YYYYMMDD,
 * {@code diaSemana} runs from Monday=1 to Sunday=7.
 */
public record CalendarDay(
        Integer idTempo,
        LocalDate dataCompleta,
        Integer ano,
        Integer mes,
        Integer dia,
        Integer trimestre,
        Integer semana,
        Integer diaSemana,
        Boolean ehFimSemana
) {

    public static CalendarDay of(LocalDate date) {
        DayOfWeek dayOfWeek = date.getDayOfWeek();
        return new CalendarDay(
                date.getYear() * 10000 + date.getMonthValue() * 100 + date.getDayOfMonth(),
                date,
                date.getYear(),
                date.getMonthValue(),
                date.getDayOfMonth(),
                date.get(IsoFields.QUARTER_OF_YEAR),
                date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR),
                dayOfWeek.getValue(),
                dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY
        );
    }
}
