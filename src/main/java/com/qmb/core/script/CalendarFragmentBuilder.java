package com.qmb.core.script;

import com.qmb.core.model.CalendarLanguage;
import com.qmb.core.model.FieldProfile;
import com.qmb.core.model.StageId;
import com.qmb.core.model.TableAnalysis;
import com.qmb.core.model.TableClassification;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Stage D: formalizes calendar tables loaded by stage B, or synthesizes a master calendar per
 * fact date field spanning the observed date range.
 */
@Component
public class CalendarFragmentBuilder implements ScriptFragmentBuilder {

    static final String SUB_NAME = "CreateMasterCalendar";

    @Override
    public StageId stage() {
        return StageId.D;
    }

    @Override
    public ScriptFragment build(BuildContext context) {
        StringBuilder sb = new StringBuilder(ScriptNames.sectionHeader("STAGE D: CALENDAR"));
        List<TableAnalysis> calendars = context.analysis().tablesOf(TableClassification.CALENDAR);
        CalendarLanguage language = context.config().calendarLanguage();

        if (!calendars.isEmpty()) {
            sb.append('\n').append("UNQUALIFY *;");
            for (TableAnalysis calendar : calendars) {
                Optional<FieldProfile> dateField = calendar.dateFields().stream().findFirst();
                if (dateField.isEmpty()) {
                    sb.append("\n\n// ").append(calendar.name()).append(": no date field to derive periods from");
                    continue;
                }
                sb.append("\n\n// Formalize calendar table ").append(calendar.name()).append('\n');
                sb.append(derivedFields(LoadStatement.into(ScriptNames.tableName(calendar))
                                .prefix("LEFT JOIN ([" + ScriptNames.tableName(calendar) + "])")
                                .distinct(),
                        ScriptNames.field(dateField.get().name()), dateField.get().name(), language)
                        .resident(ScriptNames.tableName(calendar))
                        .render());
            }
            sb.append("\n\nQUALIFY *;");
            return new ScriptFragment(StageId.D, sb.toString(), List.of());
        }

        List<String> dateFields = KeyPlan.calendarDateFields(context.analysis());
        if (dateFields.isEmpty()) {
            sb.append("\n// No date fields in the fact tables; no master calendar required");
            return new ScriptFragment(StageId.D, sb.toString(), List.of());
        }

        sb.append("\n\n").append(subroutine(language)).append("\n\n");
        sb.append("UNQUALIFY *;\n");
        Optional<ObservedDateRange> observed = ObservedDateRange.of(context.analysis(), dateFields);
        if (observed.isPresent()) {
            sb.append("// Observed date range ").append(observed.get().min()).append(" to ")
                    .append(observed.get().max()).append('\n');
            sb.append("LET vCalMinDate = Num(").append(makeDate(observed.get().min())).append(");\n");
            sb.append("LET vCalMaxDate = Num(").append(makeDate(observed.get().max())).append(");\n");
        } else {
            sb.append(residentRange(context, dateFields.get(0)));
        }

        List<String> tables = new ArrayList<>();
        for (String field : dateFields) {
            sb.append("CALL ").append(SUB_NAME).append("('").append(field).append("', $(vCalMinDate), $(vCalMaxDate));\n");
            tables.add(ScriptNames.masterCalendarName(field));
        }
        sb.append("QUALIFY *;");
        return new ScriptFragment(StageId.D, sb.toString(), tables);
    }

    private static String subroutine(CalendarLanguage language) {
        String tempCalendar = LoadStatement.into("TempCalendar")
                .column("Date($(vMinDate) + IterNo() - 1) AS TempDate")
                .from("AUTOGENERATE 1\n    WHILE $(vMinDate) + IterNo() - 1 <= $(vMaxDate);")
                .render();
        String master = derivedFields(LoadStatement.into("DIM_$(vDateField)")
                        .column("TempDate AS [$(vDateField)]"),
                "TempDate", "$(vDateField)", language)
                .resident("TempCalendar")
                .render();
        return "SUB " + SUB_NAME + "(vDateField, vMinDate, vMaxDate)\n"
                + indent(tempCalendar) + "\n\n"
                + indent(master) + "\n\n"
                + "    DROP TABLE [TempCalendar];\n"
                + "END SUB";
    }

    private static LoadStatement derivedFields(LoadStatement load, String dateExpr, String label,
                                               CalendarLanguage language) {
        if (!dateExpr.equals("TempDate")) {
            load.column(dateExpr);
        }
        return load
                .column("Year(" + dateExpr + ") AS [" + label + ".Year]")
                .column("'Q' & Ceil(Month(" + dateExpr + ") / 3) AS [" + label + ".Quarter]")
                .column("Num(Month(" + dateExpr + ")) AS [" + label + ".MonthNum]")
                .column("Pick(Num(Month(" + dateExpr + ")), " + quoted(language.monthNames()) + ") AS [" + label + ".Month]")
                .column("Week(" + dateExpr + ") AS [" + label + ".Week]")
                .column("Day(" + dateExpr + ") AS [" + label + ".Day]")
                .column("Pick(WeekDay(" + dateExpr + ") + 1, " + quoted(language.dayNames()) + ") AS [" + label + ".WeekDay]");
    }

    private static String residentRange(BuildContext context, String dateField) {
        String factTable = context.analysis().tablesOf(TableClassification.FACT).stream()
                .filter(t -> t.field(dateField).filter(FieldProfile::dateField).isPresent())
                .map(ScriptNames::tableName)
                .findFirst()
                .orElseThrow();
        String field = ScriptNames.field(dateField);
        return "// Date range not sampled; derive it from " + factTable + "\n"
                + LoadStatement.into("TempDateRange")
                        .column("Min(" + field + ") AS MinDate")
                        .column("Max(" + field + ") AS MaxDate")
                        .resident(factTable)
                        .render() + "\n"
                + "LET vCalMinDate = Num(Peek('MinDate', 0, 'TempDateRange'));\n"
                + "LET vCalMaxDate = Num(Peek('MaxDate', 0, 'TempDateRange'));\n"
                + "DROP TABLE [TempDateRange];\n";
    }

    private static String makeDate(LocalDate date) {
        return "MakeDate(" + date.getYear() + ", " + date.getMonthValue() + ", " + date.getDayOfMonth() + ")";
    }

    private static String quoted(List<String> values) {
        return values.stream().map(v -> "'" + v + "'").collect(Collectors.joining(", "));
    }

    private static String indent(String block) {
        return block.lines().map(line -> "    " + line).collect(Collectors.joining("\n"));
    }
}
