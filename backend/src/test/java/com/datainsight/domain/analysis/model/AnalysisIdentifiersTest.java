package com.datainsight.domain.analysis.model;

import com.datainsight.domain.analysis.exception.InvalidInputException;
import com.datainsight.domain.analysis.exception.UnsupportedAnalysisTypeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisIdentifiersTest {

    @Test
    @DisplayName("Analysis type ids are case-insensitive")
    void analysis_type_ids() {
        assertThat(AnalysisType.fromId("Data_Format")).isEqualTo(AnalysisType.DATA_FORMAT);
        assertThat(AnalysisType.fromId(" comprehensive ")).isEqualTo(AnalysisType.COMPREHENSIVE);
    }

    @Test
    @DisplayName("Blank analysis type is unsupported")
    void blank_analysis_type() {
        assertThatThrownBy(() -> AnalysisType.fromId(" "))
                .isInstanceOf(UnsupportedAnalysisTypeException.class);
    }

    @Test
    @DisplayName("Missing format hint means auto")
    void format_hint_default() {
        assertThat(FormatHint.fromId(null)).isEqualTo(FormatHint.AUTO);
        assertThat(FormatHint.fromId("")).isEqualTo(FormatHint.AUTO);
        assertThat(new AnalysisRequest("x", AnalysisType.TEXT, null).formatHint()).isEqualTo(FormatHint.AUTO);
    }

    @Test
    @DisplayName("Unknown format hint is invalid input")
    void unknown_format_hint() {
        assertThatThrownBy(() -> FormatHint.fromId("xml"))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Only json and csv hints are structured")
    void structured_hints() {
        assertThat(FormatHint.JSON.isStructured()).isTrue();
        assertThat(FormatHint.CSV.isStructured()).isTrue();
        assertThat(FormatHint.TEXT.isStructured()).isFalse();
        assertThat(FormatHint.AUTO.isStructured()).isFalse();
    }
}
