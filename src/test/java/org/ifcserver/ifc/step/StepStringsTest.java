package org.ifcserver.ifc.step;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StepStringsTest {

    @Test
    void encode_escapesQuotesBackslashesAndNonAscii() {
        assertThat(StepStrings.encode("It's")).isEqualTo("It''s");
        assertThat(StepStrings.encode("a\\b")).isEqualTo("a\\\\b");
        assertThat(StepStrings.encode("中文墙")).isEqualTo("\\X2\\4E2D65875899\\X0\\");
        assertThat(StepStrings.encode("Wall 中")).isEqualTo("Wall \\X2\\4E2D\\X0\\");
        assertThat(StepStrings.encode("😀")).isEqualTo("\\X4\\0001F600\\X0\\");
    }

    @Test
    void decode_handlesUcs2Ucs4AndSingleByteEscapes() {
        assertThat(StepStrings.decode("\\X2\\96F6\\X0\\件A")).isEqualTo("零件A");
        assertThat(StepStrings.decode("\\X4\\0001F600\\X0\\")).isEqualTo("😀");
        assertThat(StepStrings.decode("\\X\\E9t\\X\\E9")).isEqualTo("été");
        assertThat(StepStrings.decode("a\\\\b")).isEqualTo("a\\b");
        assertThat(StepStrings.decode("plain")).isEqualTo("plain");
    }

    @Test
    void decode_leavesMalformedSequenceAsIs() {
        assertThat(StepStrings.decode("\\X2\\4E2\\X0\\")).isEqualTo("\\X2\\4E2\\X0\\");
    }
}
