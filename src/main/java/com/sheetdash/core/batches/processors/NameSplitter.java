package com.sheetdash.core.batches.processors;

import com.sheetdash.core.Exceptions.TypeCoercionException;
import com.sheetdash.core.enums.ColumnRole;
import com.sheetdash.core.enums.NameMode;
import com.sheetdash.core.models.PersonRecord;
import com.sheetdash.core.utils.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives first and last name. A combined name is split at its last blank:
 * "Anna Maria Schmidt" gives first "Anna Maria", last "Schmidt".
 * Particle surnames ("van der Berg") are not recognised and end up split like any other name.
 */
@Slf4j
@Component
public class NameSplitter {

    public List<PersonRecord> split(List<PersonRecord> records, NameMode mode) {
        List<PersonRecord> result = new ArrayList<>(records.size());
        for (PersonRecord record : records) {
            result.add(mode == NameMode.COMBINED ? splitCombined(record) : cleanSeparate(record));
        }
        log.info("👤 Names resolved for {} record(s) ({})", result.size(), mode);
        return result;
    }

    private PersonRecord splitCombined(PersonRecord record) {
        String name = TextNormalizer.collapseWhitespace(record.getRawName());
        int lastBlank = name.lastIndexOf(' ');
        String first = lastBlank < 0 ? "" : name.substring(0, lastBlank);
        String last = lastBlank < 0 ? name : name.substring(lastBlank + 1);
        requireLastName(record, last, ColumnRole.NAME);
        return record.toBuilder()
                .rawName(null)
                .firstName(first)
                .lastName(last)
                .build();
    }

    private PersonRecord cleanSeparate(PersonRecord record) {
        String last = TextNormalizer.collapseWhitespace(record.getLastName());
        requireLastName(record, last, ColumnRole.LAST_NAME);
        return record.toBuilder()
                .firstName(TextNormalizer.collapseWhitespace(record.getFirstName()))
                .lastName(last)
                .build();
    }

    private void requireLastName(PersonRecord record, String last, ColumnRole column) {
        if (last.isEmpty()) {
            throw new TypeCoercionException(record.getSourceRow(), column.getHeader(), "",
                    "a last name is required");
        }
    }
}
