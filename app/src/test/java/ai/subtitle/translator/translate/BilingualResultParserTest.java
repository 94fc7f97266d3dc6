package ai.subtitle.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BilingualResultParserTest {

    private final BilingualResultParser parser = new BilingualResultParser();

    @Test
    @DisplayName("Colon-numbered source lines take the following plain line as their translation")
    void parsesImplicitSecondHalf() {
        ParsedTranslation parsed = parser.parse("1: Hello\n你好\n2: World\n世界");

        assertThat(parsed.units()).containsExactly(entry(1, "Hello\n你好"), entry(2, "World\n世界"));
        assertThat(parsed.formatValid()).isTrue();
    }

    @Test
    void parsesPeriodNumberedSiblingLines() {
        ParsedTranslation parsed = parser.parse("1. Hello\n1. 你好\n2. World\n2. 世界");

        assertThat(parsed.units()).containsExactly(entry(1, "Hello\n你好"), entry(2, "World\n世界"));
        assertThat(parsed.formatValid()).isTrue();
    }

    @Test
    void parsesColonNumberedSiblingLinesAndFullWidthColon() {
        ParsedTranslation sibling = parser.parse("3: Hello\n3: 你好");
        ParsedTranslation fullWidth = parser.parse("4：Hello\n你好");

        assertThat(sibling.units()).containsExactly(entry(3, "Hello\n你好"));
        assertThat(fullWidth.units()).containsExactly(entry(4, "Hello\n你好"));
        assertThat(fullWidth.formatValid()).isTrue();
    }

    @Test
    void skipsCommentaryHeadingsAndCodeFences() {
        String response = """
                Here is the translation:
                ```
                # Result
                1: Hello

                你好
                ```
                以下是翻译结果
                """;

        ParsedTranslation parsed = parser.parse(response);

        assertThat(parsed.units()).containsExactly(entry(1, "Hello\n你好"));
        assertThat(parsed.formatValid()).isTrue();
    }

    @Test
    @DisplayName("A unit without a second half is recorded but marks the response invalid")
    void recordsSingleHalfUnits() {
        ParsedTranslation parsed = parser.parse("1: a\n甲\n2: b\n乙\n3: c");

        assertThat(parsed.size()).isEqualTo(3);
        assertThat(parsed.units()).containsEntry(3, "c");
        assertThat(parsed.formatValid()).isFalse();
    }

    @Test
    void indexedLineForAnotherUnitIsNotASecondHalf() {
        ParsedTranslation parsed = parser.parse("1: Hello\n2: World\n世界");

        assertThat(parsed.units()).containsExactly(entry(1, "Hello"), entry(2, "World\n世界"));
        assertThat(parsed.formatValid()).isFalse();
    }

    @Test
    @DisplayName("A translation that starts with a clock time stays the second half of its unit")
    void timeLikeSecondHalfIsNotAnIndexedLine() {
        ParsedTranslation parsed = parser.parse("5: 10:30 is when we start\n10:30是我们开始的时间");

        assertThat(parsed.units()).containsExactly(entry(5, "10:30 is when we start\n10:30是我们开始的时间"));
        assertThat(parsed.formatValid()).isTrue();
    }

    @Test
    void colonWithoutSpaceDoesNotOpenAUnit() {
        ParsedTranslation parsed = parser.parse("3:15 is the deadline");

        assertThat(parsed.units()).isEmpty();
        assertThat(parsed.formatValid()).isFalse();
    }

    @Test
    void indexedLineWithoutTextIsNotAUnit() {
        ParsedTranslation parsed = parser.parse("1: Line 1\n一\n2:\n二\n3.\n4: Line 4\n4:");

        assertThat(parsed.units()).containsExactly(entry(1, "Line 1\n一"), entry(4, "Line 4"));
        assertThat(parsed.formatValid()).isFalse();
    }

    @Test
    void laterUnitReplacesRepeatedIndex() {
        ParsedTranslation parsed = parser.parse("1: Hello\n你好\n1: Hi\n嗨");

        assertThat(parsed.units()).containsExactly(entry(1, "Hi\n嗨"));
    }

    @Test
    void emptyOrCommentaryOnlyResponsesAreInvalid() {
        assertThat(parser.parse("").formatValid()).isFalse();
        assertThat(parser.parse(null).units()).isEmpty();
        ParsedTranslation commentary = parser.parse("Here are the lines you asked for.\n```");
        assertThat(commentary.units()).isEmpty();
        assertThat(commentary.formatValid()).isFalse();
    }

    @Test
    void recognisesCommentaryPrefixes() {
        assertThat(BilingualResultParser.isCommentary("TRANSLATION: below")).isTrue();
        assertThat(BilingualResultParser.isCommentary("翻译如下")).isTrue();
        assertThat(BilingualResultParser.isCommentary("```text")).isTrue();
        assertThat(BilingualResultParser.isCommentary("Hello there")).isFalse();
    }
}
