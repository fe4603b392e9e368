package com.vp.querylang.loader;

import com.vp.querylang.QueryLanguageException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordFileReaderTest {

    private final RecordFileReader reader = new RecordFileReader();

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldReadRecordsAsStrings() {
        List<Map<String, String>> records = reader.read(RecordFileReaderTest.class.getResourceAsStream("/records.yml"));

        assertThat(records).hasSize(3);
        assertThat(records.get(0)).containsEntry("post_title", "Hello world");
        assertThat(records.get(2)).containsEntry("menu_order", "3");
    }

    @Test
    void shouldDropNullValues() {
        List<Map<String, String>> records = reader.read(RecordFileReaderTest.class.getResourceAsStream("/records.yml"));

        assertThat(records.get(2)).doesNotContainKey("post_parent");
    }

    @Test
    void shouldReturnEmptyListForEmptyFile() {
        assertThat(reader.read(yaml(""))).isEmpty();
    }

    @Test
    void shouldRejectNonListDocument() {
        assertThatThrownBy(() -> reader.read(yaml("a: b\n")))
            .isInstanceOf(QueryLanguageException.class)
            .hasMessageContaining("list");
    }

    @Test
    void shouldRejectNonMapRecord() {
        assertThatThrownBy(() -> reader.read(yaml("- a: b\n- plain\n")))
            .isInstanceOf(QueryLanguageException.class)
            .hasMessageContaining("Record 1");
    }
}
