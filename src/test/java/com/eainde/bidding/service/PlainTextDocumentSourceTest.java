package com.eainde.bidding.service;

import com.eainde.bidding.error.EmptyDocumentException;
import com.eainde.bidding.error.UnsupportedFormatException;
import com.eainde.bidding.model.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlainTextDocumentSourceTest {

    @TempDir
    Path dir;

    private final PlainTextDocumentSource source = new PlainTextDocumentSource();

    @Test
    void loadText_shouldTrackPagesAndReplaceFormFeeds() throws IOException {
        Path file = Files.writeString(dir.resolve("tender.txt"), "第一页\f第二页\f第三页", StandardCharsets.UTF_8);

        Document doc = source.loadText(file);

        assertThat(doc.text()).isEqualTo("第一页\n第二页\n第三页");
        assertThat(doc.pageOffsets()).containsExactly(0, 4, 8);
        assertThat(doc.pageAt(doc.text().indexOf("第二页"))).isEqualTo(2);
        assertThat(doc.name()).isEqualTo("tender.txt");
    }

    @Test
    void loadText_shouldGiveTheSameContentTheSameId() throws IOException {
        Path a = Files.writeString(dir.resolve("a.txt"), "预算金额：人民币500万元整。", StandardCharsets.UTF_8);
        Path b = Files.writeString(dir.resolve("b.md"), "预算金额：人民币500万元整。", StandardCharsets.UTF_8);

        assertThat(source.loadText(a).documentId()).isEqualTo(source.loadText(b).documentId());
    }

    @Test
    void loadText_shouldRejectBinaryFormats() throws IOException {
        Path pdf = Files.write(dir.resolve("tender.pdf"), new byte[]{'%', 'P', 'D', 'F'});

        assertThatThrownBy(() -> source.loadText(pdf))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessageContaining("pdf");
    }

    @Test
    void loadText_shouldRejectInvalidUtf8() throws IOException {
        Path file = Files.write(dir.resolve("gbk.txt"), new byte[]{(byte) 0xD4, (byte) 0xA4, (byte) 0xFF});

        assertThatThrownBy(() -> source.loadText(file)).isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    void loadText_shouldRejectBlankFiles() throws IOException {
        Path file = Files.writeString(dir.resolve("empty.txt"), " \n\f\n ", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> source.loadText(file)).isInstanceOf(EmptyDocumentException.class);
    }
}
