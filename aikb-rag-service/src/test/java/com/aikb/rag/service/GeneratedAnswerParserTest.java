package com.aikb.rag.service;

import com.aikb.rag.error.MalformedResponseException;
import com.aikb.rag.model.AnswerCitation;
import com.aikb.rag.model.StructuredAnswer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeneratedAnswerParserTest {

    private final GeneratedAnswerParser parser = new GeneratedAnswerParser();

    @Nested
    @DisplayName("Valid responses")
    class ValidResponses {

        @Test
        @DisplayName("Should parse a complete answer")
        void shouldParseCompleteAnswer() {
            StructuredAnswer answer = parser.parse("""
                    {
                      "answer": "You get 25 days.",
                      "confidence": "High",
                      "citations": [{"source": "Leave Policy", "quote": "25 days of annual leave"}],
                      "missing_information": "None"
                    }""");

            assertThat(answer.answer()).isEqualTo("You get 25 days.");
            assertThat(answer.confidence()).isEqualTo("High");
            assertThat(answer.citations()).containsExactly(new AnswerCitation("Leave Policy", "25 days of annual leave"));
            assertThat(answer.hasMissingInformation()).isFalse();
        }

        @Test
        @DisplayName("Should accept code-fenced JSON and normalize confidence")
        void shouldAcceptCodeFence() {
            StructuredAnswer answer = parser.parse("```json\n{\"answer\": \"Yes\", \"confidence\": \"medium\"}\n```");

            assertThat(answer.answer()).isEqualTo("Yes");
            assertThat(answer.confidence()).isEqualTo("Medium");
            assertThat(answer.citations()).isEmpty();
            assertThat(answer.missingInformation()).isNull();
        }

        @Test
        @DisplayName("Should report missing information")
        void shouldReportMissingInformation() {
            StructuredAnswer answer = parser.parse(
                    "{\"answer\": \"Unknown\", \"confidence\": \"Low\", \"missing_information\": \"No policy for contractors\"}");

            assertThat(answer.hasMissingInformation()).isTrue();
        }
    }

    @Nested
    @DisplayName("Malformed responses")
    class MalformedResponses {

        @Test
        @DisplayName("Should reject non-JSON text")
        void shouldRejectNonJson() {
            assertThatThrownBy(() -> parser.parse("Sure! Here is your answer: 25 days."))
                    .isInstanceOf(MalformedResponseException.class);
        }

        @Test
        @DisplayName("Should reject empty output")
        void shouldRejectEmptyOutput() {
            assertThatThrownBy(() -> parser.parse("  ")).isInstanceOf(MalformedResponseException.class);
            assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(MalformedResponseException.class);
        }

        @Test
        @DisplayName("Should reject a JSON array")
        void shouldRejectJsonArray() {
            assertThatThrownBy(() -> parser.parse("[\"answer\"]")).isInstanceOf(MalformedResponseException.class);
        }

        @Test
        @DisplayName("Should reject a missing answer field")
        void shouldRejectMissingAnswer() {
            assertThatThrownBy(() -> parser.parse("{\"confidence\": \"High\"}"))
                    .isInstanceOf(MalformedResponseException.class)
                    .hasMessageContaining("answer");
        }

        @Test
        @DisplayName("Should reject an unknown confidence level")
        void shouldRejectUnknownConfidence() {
            assertThatThrownBy(() -> parser.parse("{\"answer\": \"x\", \"confidence\": \"Certain\"}"))
                    .isInstanceOf(MalformedResponseException.class);
        }

        @Test
        @DisplayName("Should reject citations that are not an array of objects")
        void shouldRejectBadCitations() {
            assertThatThrownBy(() -> parser.parse(
                    "{\"answer\": \"x\", \"confidence\": \"Low\", \"citations\": \"Leave Policy\"}"))
                    .isInstanceOf(MalformedResponseException.class);
            assertThatThrownBy(() -> parser.parse(
                    "{\"answer\": \"x\", \"confidence\": \"Low\", \"citations\": [{\"source\": \"A\"}]}"))
                    .isInstanceOf(MalformedResponseException.class);
        }
    }
}
