package com.sheetdash.core.batches.processors;

import com.sheetdash.core.enums.ColumnRole;
import com.sheetdash.core.models.EnrichedDataset;
import com.sheetdash.core.models.Fact;
import com.sheetdash.core.models.MonthKey;
import com.sheetdash.core.models.PersonRecord;
import com.sheetdash.core.models.SheetColumns;
import com.sheetdash.core.models.SheetTable;
import com.sheetdash.core.models.WideDataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Puts rows and columns into their canonical order and renders the two output sheets.
 * Rows: department, profession, last name (German collation), ties keep input order.
 */
@Slf4j
@Component
public class DatasetArranger {

    private static final List<String> IDENTITY_HEADERS = List.of(
            ColumnRole.FIRST_NAME.getHeader(),
            ColumnRole.LAST_NAME.getHeader(),
            ColumnRole.CITY.getHeader(),
            SheetColumns.REGION,
            ColumnRole.DEPARTMENT.getHeader(),
            ColumnRole.PROFESSION.getHeader(),
            ColumnRole.PART_TIME.getHeader(),
            ColumnRole.AGE.getHeader());

    private final Comparator<String> collation;

    public DatasetArranger() {
        this(Locale.GERMAN);
    }

    public DatasetArranger(Locale locale) {
        Collator collator = Collator.getInstance(locale);
        this.collation = collator::compare;
    }

    public EnrichedDataset arrange(EnrichedDataset dataset) {
        Comparator<PersonRecord> recordOrder = Comparator
                .comparing(PersonRecord::getDepartment, collation)
                .thenComparing(PersonRecord::getProfession, collation)
                .thenComparing(PersonRecord::getLastName, collation);
        Comparator<Fact> factOrder = Comparator
                .comparing(Fact::getDepartment, collation)
                .thenComparing(Fact::getLastName, collation)
                .thenComparing(Fact::getMonth);

        // List.sort is stable, equal keys keep their input order
        List<PersonRecord> records = new ArrayList<>(dataset.getRecords());
        records.sort(recordOrder);
        List<Fact> facts = new ArrayList<>(dataset.getFacts());
        facts.sort(factOrder);

        log.info("📋 Arranged {} record(s) and {} fact(s)", records.size(), facts.size());
        return new EnrichedDataset(new WideDataset(records, dataset.getMonthKeys()), facts);
    }

    /**
     * Wide sheet: identity columns, month columns in chronological order, total, monthly average.
     */
    public SheetTable wideView(EnrichedDataset dataset) {
        List<MonthKey> months = dataset.getMonthKeys();
        List<String> headers = new ArrayList<>(IDENTITY_HEADERS);
        months.forEach(month -> headers.add(month.columnName()));
        headers.add(SheetColumns.TOTAL_REVENUE);
        headers.add(SheetColumns.AVERAGE_MONTHLY_REVENUE);

        List<List<Object>> rows = new ArrayList<>(dataset.getRecords().size());
        for (PersonRecord record : dataset.getRecords()) {
            List<Object> row = new ArrayList<>(headers.size());
            row.add(record.getFirstName());
            row.add(record.getLastName());
            row.add(record.getCity());
            row.add(record.getRegion());
            row.add(record.getDepartment());
            row.add(record.getProfession());
            row.add(record.getPartTime().getLabel());
            row.add(record.getAge());
            months.forEach(month -> row.add(record.revenueFor(month)));
            row.add(record.getTotalRevenue());
            row.add(record.getAverageMonthlyRevenue());
            rows.add(row);
        }
        return new SheetTable(SheetColumns.WIDE_SHEET, headers, rows);
    }

    /**
     * Tidy sheet: identity columns, month key, revenue.
     */
    public SheetTable longView(EnrichedDataset dataset) {
        List<String> headers = new ArrayList<>(IDENTITY_HEADERS);
        headers.add(SheetColumns.FACT_MONTH);
        headers.add(SheetColumns.FACT_REVENUE);

        List<List<Object>> rows = new ArrayList<>(dataset.getFacts().size());
        for (Fact fact : dataset.getFacts()) {
            rows.add(List.of(
                    fact.getFirstName(),
                    fact.getLastName(),
                    fact.getCity(),
                    fact.getRegion(),
                    fact.getDepartment(),
                    fact.getProfession(),
                    fact.getPartTime().getLabel(),
                    fact.getAge(),
                    fact.getMonth().toString(),
                    fact.getRevenue()));
        }
        return new SheetTable(SheetColumns.LONG_SHEET, headers, rows);
    }
}
