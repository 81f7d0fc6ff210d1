package com.familygraph.service;

import com.familygraph.model.RawRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.familygraph.testutil.Records.person;
import static com.familygraph.testutil.Records.record;
import static org.assertj.core.api.Assertions.assertThat;

class RecordPathLinkIndexTest {

    private final List<RawRecord> records = List.of(
        person("I1", "John Smith"),
        record("Archive/Old John.md", "cr_id", "I2", "name", "Johnny"),
        record("Notes/No Id.md", "name", "Nobody"));

    private final RecordPathLinkIndex index = RecordPathLinkIndex.of(records);

    @Test
    void resolvesByFileName() {
        assertThat(index.resolve("[[John Smith]]")).contains("I1");
        assertThat(index.resolve("[[old john]]")).contains("I2");
    }

    @Test
    void resolvesByPathWithOrWithoutExtension() {
        assertThat(index.resolve("[[People/John Smith.md]]")).contains("I1");
        assertThat(index.resolve("[[Archive/Old John]]")).contains("I2");
    }

    @Test
    void resolvesByNameProperty() {
        assertThat(index.resolve("[[Johnny]]")).contains("I2");
    }

    @Test
    void ignoresDisplayTextAndHeadings() {
        assertThat(index.resolve("[[John Smith|Grandad]]")).contains("I1");
        assertThat(index.resolve("[[John Smith#Early life]]")).contains("I1");
    }

    @Test
    void recordsWithoutIdAreNotIndexed() {
        assertThat(index.resolve("[[Nobody]]")).isEmpty();
        assertThat(index.resolve("[[No Id]]")).isEmpty();
    }

    @Test
    void noneResolvesNothing() {
        assertThat(LinkResolutionIndex.none().resolve("[[John Smith]]")).isEmpty();
    }
}
