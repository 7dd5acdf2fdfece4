package org.showvault.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WordListParserTest {

    @Test
    void parse_trimsEachToken() {
        assertThat(WordListParser.parse("word1, word2 ,word3")).containsExactly("word1", "word2", "word3");
    }

    @Test
    void parse_blankText_isEmptyList() {
        assertThat(WordListParser.parse("")).isEmpty();
        assertThat(WordListParser.parse("   ")).isEmpty();
        assertThat(WordListParser.parse(null)).isEmpty();
    }

    @Test
    void parse_dropsEmptyTokensAndKeepsOrder() {
        assertThat(WordListParser.parse("b,, a ,  ,c")).containsExactly("b", "a", "c");
    }

    @Test
    void clean_handlesNullEntries() {
        assertThat(WordListParser.clean(Arrays.asList(" x ", null, ""))).containsExactly("x");
        assertThat(WordListParser.clean(null)).isEmpty();
    }

    @Test
    void join_thenParse_preservesTokens() {
        List<String> words = List.of("german", "french", "dutch");
        assertThat(WordListParser.join(words)).isEqualTo("german, french, dutch");
        assertThat(WordListParser.parse(WordListParser.join(words))).isEqualTo(words);
        assertThat(WordListParser.join(null)).isEmpty();
    }
}
