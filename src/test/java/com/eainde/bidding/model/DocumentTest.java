package com.eainde.bidding.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentTest {

    @Test
    void pageAtResolvesOneBasedPages() {
        Document doc = new Document("d1", "tender.txt", "a".repeat(300), List.of(0, 100, 200));

        assertThat(doc.pageAt(0)).isEqualTo(1);
        assertThat(doc.pageAt(99)).isEqualTo(1);
        assertThat(doc.pageAt(100)).isEqualTo(2);
        assertThat(doc.pageAt(299)).isEqualTo(3);
    }

    @Test
    void pageAtIsNullWithoutPages() {
        assertThat(Document.of("d1", "tender.txt", "text").pageAt(2)).isNull();
    }

    @Test
    void nullTextAndNameDefault() {
        Document doc = new Document("d1", null, null, null);

        assertThat(doc.isBlank()).isTrue();
        assertThat(doc.name()).isEqualTo("d1");
    }

    @Test
    void spanSliceAndContainment() {
        TextSpan outer = TextSpan.of(2, 10);

        assertThat(outer.slice("0123456789ab")).isEqualTo("23456789");
        assertThat(outer.contains(TextSpan.of(3, 10))).isTrue();
        assertThat(outer.contains(TextSpan.of(1, 5))).isFalse();
        assertThatThrownBy(() -> TextSpan.of(5, 4)).isInstanceOf(IllegalArgumentException.class);
    }
}
