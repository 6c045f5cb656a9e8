package com.qmb.core.model;

import java.util.List;

/**
 * Language of month and weekday labels in the generated master calendar.
 */
public enum CalendarLanguage {
    EN(List.of("Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec"),
            List.of("Mon", "Tue", "Wed", "Thu", "Fri", "Sat", "Sun")),
    HE(List.of("ינואר", "פברואר", "מרץ", "אפריל", "מאי", "יוני",
                    "יולי", "אוגוסט", "ספטמבר", "אוקטובר", "נובמבר", "דצמבר"),
            List.of("שני", "שלישי", "רביעי", "חמישי", "שישי", "שבת", "ראשון"));

    private final List<String> monthNames;
    private final List<String> dayNames;

    CalendarLanguage(List<String> monthNames, List<String> dayNames) {
        this.monthNames = monthNames;
        this.dayNames = dayNames;
    }

    public List<String> monthNames() {
        return monthNames;
    }

    /** Weekday labels starting on Monday, matching Qlik's {@code WeekDay()} numbering. */
    public List<String> dayNames() {
        return dayNames;
    }
}
