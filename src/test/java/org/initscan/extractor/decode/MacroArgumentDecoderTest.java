package org.initscan.extractor.decode;

import org.initscan.extractor.api.ExtractionErrorCode;
import org.initscan.extractor.api.ExtractionException;
import org.initscan.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class MacroArgumentDecoderTest {

    @Test
    void decodesArguments() throws ExtractionException {
        assertThat(MacroArgumentDecoder.decode("MON_TYPES(TYPE_GRASS, TYPE_POISON)")).containsExactly("TYPE_GRASS", "TYPE_POISON");
        assertThat(MacroArgumentDecoder.decode("MON_EGG_GROUPS(EGG_GROUP_MONSTER)")).containsExactly("EGG_GROUP_MONSTER");
        assertThat(MacroArgumentDecoder.decode("F(G(a, b), {c, d}, e)")).containsExactly("G(a, b)", "{c, d}", "e");
    }

    @Test
    void valueWithoutParensIsItsOwnArgument() throws ExtractionException {
        assertThat(MacroArgumentDecoder.decode(" TYPE_FIRE ")).containsExactly("TYPE_FIRE");
        assertThat(MacroArgumentDecoder.decode("  ")).isEmpty();
        assertThat(MacroArgumentDecoder.decode("MON_TYPES()")).isEmpty();
    }

    @Test
    void unmatchedParenthesisIsParseError() {
        assertThatThrownBy(() -> MacroArgumentDecoder.decode("MON_TYPES(TYPE_FIRE"))
                .isInstanceOf(ExtractionException.class)
                .extracting(e -> ((ExtractionException) e).getErrorCode())
                .isEqualTo(ExtractionErrorCode.PARSE_ERROR);
        assertThatThrownBy(() -> MacroArgumentDecoder.decode("MON_TYPES(TYPE_FIRE, {TYPE_WATER)"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Unbalanced");
    }

    @Test
    void textAfterMatchingParenthesisIsParseError() {
        assertThatThrownBy(() -> MacroArgumentDecoder.decode("FOO(a) | BAR(b)"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Unexpected text after macro call")
                .extracting(e -> ((ExtractionException) e).getErrorCode())
                .isEqualTo(ExtractionErrorCode.PARSE_ERROR);
    }

    @Test
    void closingParenthesisWithoutOpeningIsParseError() {
        assertThatThrownBy(() -> MacroArgumentDecoder.decode("TYPE_FIRE)"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Unmatched parenthesis");
    }

    @Test
    void parenthesisInsideStringArgumentIsIgnored() throws ExtractionException {
        assertThat(MacroArgumentDecoder.decode("_(\"a)\", b)")).containsExactly("\"a)\"", "b");
    }
}
