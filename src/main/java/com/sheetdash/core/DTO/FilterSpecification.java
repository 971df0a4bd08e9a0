package com.sheetdash.core.DTO;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.sheetdash.core.enums.PartTimeFilter;
import com.sheetdash.core.models.Fact;
import com.sheetdash.core.models.MonthKey;
import com.sheetdash.core.models.PersonRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Active dashboard filters. An empty set or a {@code null} bound means "no restriction".
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FilterSpecification {

    @Builder.Default
    private Set<String> departments = Set.of();
    @Builder.Default
    private Set<String> regions = Set.of();
    @Builder.Default
    private Set<String> cities = Set.of();
    @Builder.Default
    private Set<String> professions = Set.of();
    @Builder.Default
    private PartTimeFilter partTime = PartTimeFilter.BOTH;
    private Integer minAge;
    private Integer maxAge;
    private MonthKey startMonth;
    private MonthKey endMonth;

    public static FilterSpecification matchAll() {
        return FilterSpecification.builder().build();
    }

    /**
     * Default dashboard filter: the last {@code window} discovered months, all categories.
     */
    public static FilterSpecification defaultFor(List<MonthKey> monthKeys, int window) {
        FilterSpecificationBuilder builder = FilterSpecification.builder();
        if (!monthKeys.isEmpty()) {
            int from = Math.max(0, monthKeys.size() - window);
            builder.startMonth(monthKeys.get(from)).endMonth(monthKeys.get(monthKeys.size() - 1));
        }
        return builder.build();
    }

    /**
     * Detached copy with unmodifiable sets, so later edits to this filter do not reach a stored result.
     */
    public FilterSpecification snapshot() {
        return toBuilder()
                .departments(frozen(departments))
                .regions(frozen(regions))
                .cities(frozen(cities))
                .professions(frozen(professions))
                .build();
    }

    public boolean matches(PersonRecord record) {
        return matchesPerson(record.getDepartment(), record.getRegion(), record.getCity(),
                record.getProfession(), record.getAge())
                && partTimeFilter().accepts(record.getPartTime());
    }

    public boolean matches(Fact fact) {
        return matchesMonth(fact.getMonth())
                && matchesPerson(fact.getDepartment(), fact.getRegion(), fact.getCity(),
                fact.getProfession(), fact.getAge())
                && partTimeFilter().accepts(fact.getPartTime());
    }

    public boolean matchesMonth(MonthKey month) {
        return month.isBetween(startMonth, endMonth);
    }

    @JsonIgnore
    public boolean isMonthRangeInverted() {
        return startMonth != null && endMonth != null && startMonth.compareTo(endMonth) > 0;
    }

    private boolean matchesPerson(String department, String region, String city, String profession, int age) {
        return accepts(departments, department)
                && accepts(regions, region)
                && accepts(cities, city)
                && accepts(professions, profession)
                && (minAge == null || age >= minAge)
                && (maxAge == null || age <= maxAge);
    }

    private PartTimeFilter partTimeFilter() {
        return partTime == null ? PartTimeFilter.BOTH : partTime;
    }

    private static Set<String> frozen(Set<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
    }

    private static boolean accepts(Collection<String> allowed, String value) {
        return allowed == null || allowed.isEmpty() || allowed.contains(value);
    }
}
