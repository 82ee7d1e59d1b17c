package guraa.sitephoto.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Selects the photos of one (site, task) group, optionally limited to a date range.
 * Both range ends are inclusive; a null end is open.
 */
@Value
public class ReportSelector {

    String site;

    String task;

    LocalDate from;

    LocalDate to;

    @JsonCreator
    public ReportSelector(@JsonProperty("site") String site,
                          @JsonProperty("task") String task,
                          @JsonProperty("from") LocalDate from,
                          @JsonProperty("to") LocalDate to) {
        if (site == null || site.isBlank()) {
            throw new IllegalArgumentException("Site is required");
        }
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("Task is required");
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("Range start " + from + " is after range end " + to);
        }
        this.site = site.trim();
        this.task = task.trim();
        this.from = from;
        this.to = to;
    }

    public static ReportSelector forMonth(String site, String task, YearMonth month) {
        return new ReportSelector(site, task, month.atDay(1), month.atEndOfMonth());
    }

    public boolean includesMonth(YearMonth month) {
        return (from == null || !month.isBefore(YearMonth.from(from)))
                && (to == null || !month.isAfter(YearMonth.from(to)));
    }

    public boolean includesDate(LocalDate date) {
        return (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
    }
}
