package com.secrecon.store;

import com.secrecon.model.TagRecord;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link LabelLookup} backed by the tag table. When a tag is defined under several taxonomy
 * versions, the first definition with a non-blank label wins.
 */
public final class TagLabelLookup implements LabelLookup {

    private final Map<String, TagRecord> tagsByName;
    private final List<TagRecord> records;

    public TagLabelLookup(Collection<TagRecord> records) {
        Objects.requireNonNull(records, "records");
        Map<String, TagRecord> byName = new LinkedHashMap<>();
        for (TagRecord record : records) {
            TagRecord existing = byName.get(record.getTag());
            if (existing == null || isBlank(existing.getLabel())) {
                byName.put(record.getTag(), record);
            }
        }
        this.tagsByName = Map.copyOf(byName);
        this.records = List.copyOf(records);
    }

    @Override
    public Optional<String> labelFor(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        TagRecord record = tagsByName.get(tag);
        if (record == null || isBlank(record.getLabel())) {
            return Optional.empty();
        }
        return Optional.of(record.getLabel());
    }

    public Optional<TagRecord> definitionFor(String tag) {
        return Optional.ofNullable(tag == null ? null : tagsByName.get(tag));
    }

    public List<TagRecord> allTags() {
        return records;
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
