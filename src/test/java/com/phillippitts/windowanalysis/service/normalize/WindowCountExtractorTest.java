package com.phillippitts.windowanalysis.service.normalize;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WindowCountExtractorTest {

    @Test
    void acceptsCommonPhrasings() {
        assertThat(WindowCountExtractor.extract("windows count 6")).hasValue(6);
        assertThat(WindowCountExtractor.extract("1. **Window Count**: 2")).hasValue(2);
        assertThat(WindowCountExtractor.extract("window count:2")).hasValue(2);
        assertThat(WindowCountExtractor.extract("window_count: 3")).hasValue(3);
    }

    @Test
    void firstStatementWins() {
        assertThat(WindowCountExtractor.extract("Window count: 2. Earlier photo window count: 5")).hasValue(2);
    }

    @Test
    void absentOrAbsurdCountsAreIgnored() {
        assertThat(WindowCountExtractor.extract(null)).isEmpty();
        assertThat(WindowCountExtractor.extract("")).isEmpty();
        assertThat(WindowCountExtractor.extract("three windows")).isEmpty();
        assertThat(WindowCountExtractor.extract("window count: 99999999999")).isEmpty();
    }
}
