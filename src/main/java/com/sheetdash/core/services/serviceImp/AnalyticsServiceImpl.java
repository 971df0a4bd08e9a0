package com.sheetdash.core.services.serviceImp;

import com.sheetdash.core.DTO.FilterSpecification;
import com.sheetdash.core.DTO.analytics.AggregationResult;
import com.sheetdash.core.DTO.analytics.DepartmentRevenue;
import com.sheetdash.core.DTO.analytics.FilterOptions;
import com.sheetdash.core.DTO.analytics.HeatmapMatrix;
import com.sheetdash.core.DTO.analytics.HistogramBin;
import com.sheetdash.core.DTO.analytics.KpiSummary;
import com.sheetdash.core.DTO.analytics.MonthlyRevenue;
import com.sheetdash.core.DTO.analytics.PartTimeComparison;
import com.sheetdash.core.DTO.analytics.ProfessionRevenue;
import com.sheetdash.core.Exceptions.AnalyticsException;
import com.sheetdash.core.config.AnalyticsProperties;
import com.sheetdash.core.models.EnrichedDataset;
import com.sheetdash.core.models.Fact;
import com.sheetdash.core.models.MonthKey;
import com.sheetdash.core.models.PersonRecord;
import com.sheetdash.core.services.AnalyticsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes dashboard KPIs and chart series for one filter.
 * <p>
 * Records and facts are each scanned once; every statistic is derived from those two filtered
 * subsets. Revenue figures cover the active month range only. A filter matching nobody yields
 * zeros and empty series, never an exception.
 */
@Service
@Slf4j
public class AnalyticsServiceImpl implements AnalyticsService {

    private final AnalyticsProperties properties;
    private final Comparator<String> alphabetical;

    public AnalyticsServiceImpl(AnalyticsProperties properties) {
        this.properties = properties;
        Collator collator = Collator.getInstance(Locale.GERMAN);
        this.alphabetical = collator::compare;
    }

    @Override
    public FilterSpecification defaultFilter(EnrichedDataset dataset) {
        return FilterSpecification.defaultFor(dataset.getMonthKeys(), properties.getDefaultMonthWindow());
    }

    @Override
    public AggregationResult aggregate(EnrichedDataset dataset, FilterSpecification filter) {
        FilterSpecification applied = (filter == null ? defaultFilter(dataset) : filter).snapshot();
        if (applied.isMonthRangeInverted()) {
            throw new AnalyticsException("Start month " + applied.getStartMonth()
                    + " cannot be after end month " + applied.getEndMonth());
        }

        List<MonthKey> activeMonths = dataset.getMonthKeys().stream()
                .filter(applied::matchesMonth)
                .collect(Collectors.toList());

        List<PersonRecord> records = dataset.getRecords().stream()
                .filter(applied::matches)
                .collect(Collectors.toList());

        List<Fact> facts = dataset.getFacts().stream()
                .filter(applied::matches)
                .collect(Collectors.toList());

        log.info("📊 Aggregating {} of {} record(s), {} fact(s) over {} month(s)",
                records.size(), dataset.getRecords().size(), facts.size(), activeMonths.size());

        FilterOptions options = filterOptions(dataset);
        if (records.isEmpty()) {
            return emptyResult(applied, activeMonths, dataset.getRecords().size(), options);
        }

        Map<Integer, Double> periodRevenue = new HashMap<>();
        for (Fact fact : facts) {
            periodRevenue.merge(fact.getSourceRow(), fact.getRevenue(), Double::sum);
        }
        Function<PersonRecord, Double> revenueOf = r -> periodRevenue.getOrDefault(r.getSourceRow(), 0.0);

        double totalRevenue = 0.0;
        for (PersonRecord record : records) {
            totalRevenue += revenueOf.apply(record);
        }

        List<DepartmentRevenue> departments = revenueByDepartment(records, revenueOf, totalRevenue);
        Map<MonthKey, Map<String, Double>> monthByDepartment = monthByDepartment(records, facts, activeMonths);

        return AggregationResult.builder()
                .appliedFilter(applied)
                .activeMonths(List.copyOf(activeMonths))
                .kpis(kpis(records, totalRevenue, activeMonths.size(), dataset.getRecords().size(), departments))
                .partTime(partTimeComparison(records, revenueOf))
                .revenueByDepartment(departments)
                .timeSeries(timeSeries(monthByDepartment))
                .topProfessions(topProfessions(records, revenueOf))
                .revenueDistribution(histogram(records.stream().map(revenueOf).collect(Collectors.toList())))
                .heatmap(heatmap(monthByDepartment, activeMonths))
                .filterOptions(options)
                .build();
    }

    private KpiSummary kpis(List<PersonRecord> records, double totalRevenue, int monthCount,
                            int totalHeadcount, List<DepartmentRevenue> departments) {
        int headcount = records.size();
        List<Integer> ages = records.stream()
                .map(PersonRecord::getAge)
                .sorted()
                .collect(Collectors.toList());
        double averageAge = ages.stream().mapToInt(Integer::intValue).average().orElse(0.0);

        DepartmentRevenue top = departments.isEmpty() ? null : departments.get(0);
        double averagePerPerson = totalRevenue / headcount;

        return KpiSummary.builder()
                .headcount(headcount)
                .totalHeadcount(totalHeadcount)
                .activeMonthCount(monthCount)
                .totalRevenue(totalRevenue)
                .averageRevenuePerPerson(averagePerPerson)
                .averageMonthlyRevenuePerPerson(monthCount == 0 ? 0.0 : averagePerPerson / monthCount)
                .topDepartment(top == null ? null : top.getDepartment())
                .topDepartmentRevenue(top == null ? 0.0 : top.getRevenue())
                .topDepartmentShare(top == null ? 0.0 : top.getShare())
                .averageAge(averageAge)
                .medianAge(median(ages))
                .build();
    }

    static double median(List<Integer> sorted) {
        int size = sorted.size();
        if (size == 0) {
            return 0.0;
        }
        if (size % 2 == 1) {
            return sorted.get(size / 2);
        }
        return (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
    }

    private PartTimeComparison partTimeComparison(List<PersonRecord> records, Function<PersonRecord, Double> revenueOf) {
        int partTime = 0;
        int fullTime = 0;
        double partTimeRevenue = 0.0;
        double fullTimeRevenue = 0.0;
        for (PersonRecord record : records) {
            if (record.isPartTime()) {
                partTime++;
                partTimeRevenue += revenueOf.apply(record);
            } else {
                fullTime++;
                fullTimeRevenue += revenueOf.apply(record);
            }
        }
        return PartTimeComparison.builder()
                .partTimeCount(partTime)
                .fullTimeCount(fullTime)
                .partTimeRatio(records.isEmpty() ? 0.0 : (double) partTime / records.size())
                .averagePartTimeRevenue(partTime == 0 ? 0.0 : partTimeRevenue / partTime)
                .averageFullTimeRevenue(fullTime == 0 ? 0.0 : fullTimeRevenue / fullTime)
                .build();
    }

    private List<DepartmentRevenue> revenueByDepartment(List<PersonRecord> records,
                                                        Function<PersonRecord, Double> revenueOf,
                                                        double totalRevenue) {
        Map<String, double[]> totals = new LinkedHashMap<>();   // department -> {revenue, headcount}
        for (PersonRecord record : records) {
            double[] entry = totals.computeIfAbsent(record.getDepartment(), d -> new double[2]);
            entry[0] += revenueOf.apply(record);
            entry[1]++;
        }
        return totals.entrySet().stream()
                .map(e -> DepartmentRevenue.builder()
                        .department(e.getKey())
                        .revenue(e.getValue()[0])
                        .headcount((int) e.getValue()[1])
                        .share(totalRevenue == 0.0 ? 0.0 : e.getValue()[0] / totalRevenue)
                        .build())
                .sorted(Comparator.comparingDouble(DepartmentRevenue::getRevenue).reversed()
                        .thenComparing(DepartmentRevenue::getDepartment, alphabetical))
                .collect(Collectors.toList());
    }

    private List<ProfessionRevenue> topProfessions(List<PersonRecord> records, Function<PersonRecord, Double> revenueOf) {
        Map<String, double[]> totals = new LinkedHashMap<>();   // profession -> {revenue, headcount}
        for (PersonRecord record : records) {
            double[] entry = totals.computeIfAbsent(record.getProfession(), p -> new double[2]);
            entry[0] += revenueOf.apply(record);
            entry[1]++;
        }
        return totals.entrySet().stream()
                .map(e -> ProfessionRevenue.builder()
                        .profession(e.getKey())
                        .revenue(e.getValue()[0])
                        .headcount((int) e.getValue()[1])
                        .averageRevenue(e.getValue()[0] / e.getValue()[1])
                        .build())
                .sorted(Comparator.comparingDouble(ProfessionRevenue::getRevenue).reversed()
                        .thenComparing(ProfessionRevenue::getProfession, alphabetical))
                .limit(properties.getTopProfessions())
                .collect(Collectors.toList());
    }

    /**
     * Revenue per active month and department. Every department of the filtered records appears
     * in every month, with zero where it had no revenue.
     */
    private Map<MonthKey, Map<String, Double>> monthByDepartment(List<PersonRecord> records, List<Fact> facts,
                                                                 List<MonthKey> activeMonths) {
        TreeSet<String> departments = new TreeSet<>(alphabetical);
        records.forEach(r -> departments.add(r.getDepartment()));

        Map<MonthKey, Map<String, Double>> matrix = new TreeMap<>();
        for (MonthKey month : activeMonths) {
            Map<String, Double> row = new LinkedHashMap<>();
            departments.forEach(d -> row.put(d, 0.0));
            matrix.put(month, row);
        }
        for (Fact fact : facts) {
            Map<String, Double> row = matrix.get(fact.getMonth());
            if (row != null) {
                row.merge(fact.getDepartment(), fact.getRevenue(), Double::sum);
            }
        }
        return matrix;
    }

    private List<MonthlyRevenue> timeSeries(Map<MonthKey, Map<String, Double>> monthByDepartment) {
        List<MonthlyRevenue> series = new ArrayList<>(monthByDepartment.size());
        monthByDepartment.forEach((month, byDepartment) -> series.add(MonthlyRevenue.builder()
                .month(month)
                .total(byDepartment.values().stream().mapToDouble(Double::doubleValue).sum())
                .byDepartment(Collections.unmodifiableMap(new LinkedHashMap<>(byDepartment)))
                .build()));
        return series;
    }

    private HeatmapMatrix heatmap(Map<MonthKey, Map<String, Double>> monthByDepartment, List<MonthKey> activeMonths) {
        if (activeMonths.isEmpty()) {
            return HeatmapMatrix.EMPTY;
        }
        List<String> departments = new ArrayList<>(monthByDepartment.get(activeMonths.get(0)).keySet());
        List<List<Double>> values = new ArrayList<>(departments.size());
        double max = 0.0;
        for (String department : departments) {
            List<Double> row = new ArrayList<>(activeMonths.size());
            for (MonthKey month : activeMonths) {
                double value = monthByDepartment.get(month).get(department);
                row.add(value);
                max = Math.max(max, value);
            }
            values.add(Collections.unmodifiableList(row));
        }
        return HeatmapMatrix.builder()
                .departments(List.copyOf(departments))
                .months(List.copyOf(activeMonths))
                .values(Collections.unmodifiableList(values))
                .maxValue(max)
                .build();
    }

    /**
     * Equal-width bins between the smallest and largest value; a single bin when all values are equal.
     */
    List<HistogramBin> histogram(List<Double> values) {
        if (values.isEmpty()) {
            return List.of();
        }
        double min = values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        if (min == max) {
            return List.of(HistogramBin.builder().lowerBound(min).upperBound(max).count(values.size()).build());
        }

        int bins = properties.getHistogramBins();
        double width = (max - min) / bins;
        int[] counts = new int[bins];
        for (double value : values) {
            int index = (int) Math.floor((value - min) / width);
            counts[Math.min(Math.max(index, 0), bins - 1)]++;
        }

        List<HistogramBin> histogram = new ArrayList<>(bins);
        for (int i = 0; i < bins; i++) {
            histogram.add(HistogramBin.builder()
                    .lowerBound(min + i * width)
                    .upperBound(i == bins - 1 ? max : min + (i + 1) * width)
                    .count(counts[i])
                    .build());
        }
        return histogram;
    }

    private FilterOptions filterOptions(EnrichedDataset dataset) {
        List<PersonRecord> all = dataset.getRecords();
        return FilterOptions.builder()
                .departments(distinct(all, PersonRecord::getDepartment))
                .regions(distinct(all, PersonRecord::getRegion))
                .cities(distinct(all, PersonRecord::getCity))
                .professions(distinct(all, PersonRecord::getProfession))
                .months(dataset.getMonthKeys())
                .minAge(all.stream().mapToInt(PersonRecord::getAge).min().orElse(0))
                .maxAge(all.stream().mapToInt(PersonRecord::getAge).max().orElse(0))
                .build();
    }

    private List<String> distinct(List<PersonRecord> records, Function<PersonRecord, String> field) {
        TreeSet<String> values = new TreeSet<>(alphabetical);
        records.forEach(r -> values.add(field.apply(r)));
        return List.copyOf(values);
    }

    private AggregationResult emptyResult(FilterSpecification applied, List<MonthKey> activeMonths,
                                          int totalHeadcount, FilterOptions options) {
        log.info("📭 No record matches the filter, returning empty aggregation");
        return AggregationResult.builder()
                .appliedFilter(applied)
                .activeMonths(List.copyOf(activeMonths))
                .kpis(KpiSummary.builder()
                        .totalHeadcount(totalHeadcount)
                        .activeMonthCount(activeMonths.size())
                        .build())
                .partTime(PartTimeComparison.builder().build())
                .revenueByDepartment(List.of())
                .timeSeries(List.of())
                .topProfessions(List.of())
                .revenueDistribution(List.of())
                .heatmap(HeatmapMatrix.EMPTY)
                .filterOptions(options)
                .build();
    }
}
