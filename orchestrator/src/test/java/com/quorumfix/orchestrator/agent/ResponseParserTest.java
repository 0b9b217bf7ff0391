package com.quorumfix.orchestrator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quorumfix.orchestrator.llm.WireFormat;
import com.quorumfix.orchestrator.provider.ProviderId;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ResponseParser.
 *
 * Only Jackson is involved: no Spring context, no mocks, no network.
 */
class ResponseParserTest {

    private final ObjectMapper   mapper = new ObjectMapper();
    private final ResponseParser parser = new ResponseParser(mapper);

    // ------------------------------------------------------------------
    // parsePayload
    // ------------------------------------------------------------------

    @Test
    void parsePayload_jsonFence_returnsSuccessWithAllFields() {
        String text = """
                Here is my analysis:
                ```json
                {
                  "analysis": "Index is off by one",
                  "root_cause": "Loop runs to len inclusive",
                  "proposed_fix": "for i in range(len(items)):",
                  "reasoning": "Stops before the end",
                  "confidence": 0.85,
                  "alternative_approaches": ["use enumerate", "iterate items directly"]
                }
                ```
                """;

        ProviderCallResult result = parser.parsePayload(text);

        assertThat(result).isInstanceOf(ProviderCallResult.Success.class);
        ProviderCallResult.Success success = (ProviderCallResult.Success) result;
        assertThat(success.analysis()).isEqualTo("Index is off by one");
        assertThat(success.rootCause()).isEqualTo("Loop runs to len inclusive");
        assertThat(success.proposedFix()).isEqualTo("for i in range(len(items)):");
        assertThat(success.reasoning()).isEqualTo("Stops before the end");
        assertThat(success.confidence()).isEqualTo(0.85);
        assertThat(success.alternativeApproaches()).containsExactly("use enumerate", "iterate items directly");
    }

    @Test
    void parsePayload_wrappedInProse_extractsObject() {
        String text = "Sure! {\"analysis\": \"a\", \"proposed_fix\": \"x = 1\", \"confidence\": 0.7} Hope that helps.";

        ProviderCallResult result = parser.parsePayload(text);

        assertThat(result).isInstanceOf(ProviderCallResult.Success.class);
        assertThat(((ProviderCallResult.Success) result).proposedFix()).isEqualTo("x = 1");
    }

    @Test
    void parsePayload_confidenceOutOfRange_isClamped() {
        ProviderCallResult result = parser.parsePayload("{\"proposed_fix\": \"f\", \"confidence\": 1.7}");

        assertThat(((ProviderCallResult.Success) result).confidence()).isEqualTo(1.0);
    }

    @Test
    void parsePayload_missingConfidence_defaultsToHalf() {
        ProviderCallResult result = parser.parsePayload("{\"proposed_fix\": \"f\"}");

        assertThat(((ProviderCallResult.Success) result).confidence()).isEqualTo(ResponseParser.DEFAULT_CONFIDENCE);
    }

    @Test
    void parsePayload_singleAlternativeString_becomesList() {
        ProviderCallResult result = parser.parsePayload(
                "{\"proposed_fix\": \"f\", \"alternative_approaches\": \"rewrite it\"}");

        assertThat(((ProviderCallResult.Success) result).alternativeApproaches()).containsExactly("rewrite it");
    }

    @Test
    void parsePayload_noJson_salvagesRawTextWithLowConfidence() {
        String text = "I think the problem is in the parser but I am not sure.";

        ProviderCallResult result = parser.parsePayload(text);

        assertThat(result).isInstanceOf(ProviderCallResult.ParseError.class);
        ProviderResponse response = result.toResponse(ProviderId.QWEN, Duration.ofMillis(10));
        assertThat(response.isSalvaged()).isTrue();
        assertThat(response.hasError()).isTrue();
        assertThat(response.analysis()).isEqualTo(text);
        assertThat(response.proposedFix()).isEmpty();
        assertThat(response.confidence()).isEqualTo(ProviderCallResult.ParseError.SALVAGED_CONFIDENCE);
        assertThat(response.reasoning()).isEqualTo("Failed to parse structured response");
        assertThat(response.hasProposal()).isFalse();
    }

    @Test
    void parsePayload_brokenJson_isParseError() {
        ProviderCallResult result = parser.parsePayload("```json\n{\"proposed_fix\": \"f\",\n```");

        assertThat(result).isInstanceOf(ProviderCallResult.ParseError.class);
        assertThat(((ProviderCallResult.ParseError) result).detail()).startsWith("JSON parse error");
    }

    // ------------------------------------------------------------------
    // parse (envelope)
    // ------------------------------------------------------------------

    @Test
    void parse_openAiEnvelope_readsFirstChoice() throws Exception {
        String body = mapper.writeValueAsString(Map.of("choices", List.of(
                Map.of("message", Map.of("role", "assistant",
                        "content", "{\"proposed_fix\": \"add null check\", \"confidence\": 0.8}")))));

        ProviderCallResult result = parser.parse(WireFormat.OPENAI_CHAT, body);

        assertThat(result).isInstanceOf(ProviderCallResult.Success.class);
        assertThat(((ProviderCallResult.Success) result).proposedFix()).isEqualTo("add null check");
    }

    @Test
    void parse_anthropicEnvelope_readsTextBlock() throws Exception {
        String body = mapper.writeValueAsString(Map.of("content", List.of(
                Map.of("type", "text",
                        "text", "```json\n{\"proposed_fix\": \"guard empty input\", \"confidence\": 0.9}\n```"))));

        ProviderCallResult result = parser.parse(WireFormat.ANTHROPIC_MESSAGES, body);

        assertThat(result).isInstanceOf(ProviderCallResult.Success.class);
        assertThat(((ProviderCallResult.Success) result).confidence()).isEqualTo(0.9);
    }

    @Test
    void parse_envelopeWithoutText_isParseError() {
        ProviderCallResult result = parser.parse(WireFormat.OPENAI_CHAT, "{\"choices\": []}");

        assertThat(result).isInstanceOf(ProviderCallResult.ParseError.class);
    }

    @Test
    void parse_notJsonAtAll_isParseErrorKeepingBody() {
        ProviderCallResult result = parser.parse(WireFormat.OPENAI_CHAT, "<html>Bad Gateway</html>");

        assertThat(result).isInstanceOf(ProviderCallResult.ParseError.class);
        assertThat(((ProviderCallResult.ParseError) result).rawText()).isEqualTo("<html>Bad Gateway</html>");
    }

    @Test
    void parsePayload_jsonFenceWithNestedCodeFence_fallsBackToBraceSpan() {
        String text = "Here you go:\n```json\n"
                + "{\"analysis\":\"npe\","
                + "\"proposed_fix\":\"```python\\nif x is None:\\n    return\\n```\","
                + "\"reasoning\":\"guard the lookup\","
                + "\"confidence\":0.9}\n```";

        ProviderCallResult result = parser.parsePayload(text);

        assertThat(result).isInstanceOf(ProviderCallResult.Success.class);
        ProviderCallResult.Success success = (ProviderCallResult.Success) result;
        assertThat(success.analysis()).isEqualTo("npe");
        assertThat(success.proposedFix()).isEqualTo("```python\nif x is None:\n    return\n```");
        assertThat(success.confidence()).isEqualTo(0.9);
    }

    @Test
    void parsePayload_fenceHoldsArray_usesObjectFromLaterCandidate() {
        String text = """
                ```json
                ["not", "the", "payload"]
                ```
                Final answer: {"proposed_fix": "z", "confidence": 0.4}
                """;

        ProviderCallResult result = parser.parsePayload(text);

        assertThat(result).isInstanceOf(ProviderCallResult.Success.class);
        assertThat(((ProviderCallResult.Success) result).proposedFix()).isEqualTo("z");
    }

    // ------------------------------------------------------------------
    // jsonCandidates
    // ------------------------------------------------------------------

    @Test
    void jsonCandidates_jsonFenceComesBeforeBraces() {
        String text = """
                The map {a: 1} is wrong.
                ```json
                {"proposed_fix": "x"}
                ```
                """;

        assertThat(ResponseParser.jsonCandidates(text))
                .first().isEqualTo("{\"proposed_fix\": \"x\"}");
    }

    @Test
    void jsonCandidates_unlabelledFenceWithObject_isOffered() {
        String text = """
                ```
                {"proposed_fix": "y"}
                ```
                """;

        assertThat(ResponseParser.jsonCandidates(text))
                .containsExactly("{\"proposed_fix\": \"y\"}");
    }

    @Test
    void jsonCandidates_noBraces_returnsEmpty() {
        assertThat(ResponseParser.jsonCandidates("no json here")).isEmpty();
        assertThat(ResponseParser.jsonCandidates(null)).isEmpty();
    }
}
