package com.dorkscan.scanner.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DorkQueryTest {

    @Test
    void prefixesSiteWhenTargetIsSet() {
        DorkQuery q = DorkQuery.build("files", "filetype:pdf confidential", "example.com");

        assertThat(q.category()).isEqualTo("files");
        assertThat(q.pattern()).isEqualTo("filetype:pdf confidential");
        assertThat(q.query()).isEqualTo("site:example.com filetype:pdf confidential");
    }

    @Test
    void usesPatternVerbatimWithoutTarget() {
        assertThat(DorkQuery.build("files", "inurl:admin", null).query()).isEqualTo("inurl:admin");
        assertThat(DorkQuery.build("files", "inurl:admin", "  ").query()).isEqualTo("inurl:admin");
    }

    @Test
    void emptyPatternPassesThrough() {
        assertThat(DorkQuery.build("files", "", null).query()).isEmpty();
    }
}
