package com.sheetdash.core.batches.processors;

import com.sheetdash.core.models.EnrichedDataset;
import com.sheetdash.core.models.Fact;
import com.sheetdash.core.models.MonthKey;
import com.sheetdash.core.models.PersonRecord;
import com.sheetdash.core.models.WideDataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Orders the revenue months, computes per-person totals and averages, and unpivots the
 * monthly columns into one {@link Fact} per (person, month).
 */
@Slf4j
@Component
public class RevenueHarmonizer {

    public EnrichedDataset harmonize(List<PersonRecord> records, List<MonthKey> discoveredMonths) {
        // chronological and duplicate free, whatever order the columns came in
        List<MonthKey> months = new ArrayList<>(new TreeSet<>(discoveredMonths));

        List<PersonRecord> enriched = new ArrayList<>(records.size());
        List<Fact> facts = new ArrayList<>(records.size() * months.size());

        for (PersonRecord record : records) {
            Map<MonthKey, Double> revenue = new LinkedHashMap<>();
            double total = 0.0;
            for (MonthKey month : months) {
                double amount = record.revenueFor(month);
                revenue.put(month, amount);
                total += amount;
            }

            PersonRecord harmonized = record.toBuilder()
                    .monthlyRevenue(revenue)
                    .totalRevenue(total)
                    .averageMonthlyRevenue(averageOf(total, months.size()))
                    .build();
            enriched.add(harmonized);

            for (MonthKey month : months) {
                facts.add(Fact.of(harmonized, month));
            }
        }

        log.info("💶 Harmonized {} month(s) for {} record(s): {} fact row(s)",
                months.size(), enriched.size(), facts.size());
        return new EnrichedDataset(new WideDataset(enriched, months), facts);
    }

    /**
     * Average over all discovered months, idle months included, rounded half-up to cents.
     */
    static double averageOf(double total, int monthCount) {
        if (monthCount == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(total)
                .divide(BigDecimal.valueOf(monthCount), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
