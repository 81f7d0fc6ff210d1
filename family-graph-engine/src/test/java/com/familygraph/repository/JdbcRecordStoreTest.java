package com.familygraph.repository;

import com.familygraph.model.RawRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Sql("/smith-vault.sql")
class JdbcRecordStoreTest {

    @Autowired
    private JdbcRecordStore recordStore;

    @Autowired
    private JdbcTemplate jdbc;

    @Test
    void findAllReturnsEveryRecordOrderedByPath() {
        List<RawRecord> records = recordStore.findAll();

        assertThat(records).extracting(RawRecord::path).containsExactly(
            "People/Alice Smith.md",
            "People/Bill Stubbs.md",
            "People/Frank Smith.md",
            "People/George Smith.md",
            "People/Martha Brown.md",
            "Places/Leeds.md",
            "Sources/1851 Census.md");
    }

    @Test
    void parsesJsonPropertiesAndTags() {
        RawRecord martha = recordStore.findAll().stream()
            .filter(r -> r.path().equals("People/Martha Brown.md"))
            .findFirst()
            .orElseThrow();

        assertThat(martha.properties()).containsEntry("cr_id", "M").containsEntry("collection", "Brown");
        assertThat(martha.tags()).containsExactly("#person");
    }

    @Test
    void listPropertiesStayLists() {
        RawRecord census = recordStore.findAll().stream()
            .filter(r -> r.path().startsWith("Sources/"))
            .findFirst()
            .orElseThrow();

        assertThat(census.properties().get("persons")).isEqualTo(List.of("[[Frank Smith]]", "[[Alice Smith]]"));
        assertThat(census.tags()).isEmpty();
    }

    @Test
    void malformedJsonSkipsOnlyThatRecord() {
        jdbc.update("INSERT INTO vault_record (path, properties, tags) VALUES (?, ?, ?)",
            "People/Broken.md", "{\"cr_id\": ", null);
        jdbc.update("INSERT INTO vault_record (path, properties, tags) VALUES (?, ?, ?)",
            "People/Bad Tags.md", "{\"cr_id\": \"T\"}", "[\"#person\"");

        List<RawRecord> records = recordStore.findAll();

        assertThat(records).hasSize(7);
        assertThat(records).extracting(RawRecord::path)
            .doesNotContain("People/Broken.md", "People/Bad Tags.md")
            .contains("People/Alice Smith.md", "Sources/1851 Census.md");
    }
}
