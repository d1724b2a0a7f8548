package com.fastalert.core.template;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class TruncationsTest {

    @Test
    void shouldKeepShortText() {
        Truncations.Truncated t = Truncations.inRunes("hello", 10);
        assertThat(t.value()).isEqualTo("hello");
        assertThat(t.truncated()).isFalse();
    }

    @Test
    void shouldReplaceLastRuneWithEllipsis() {
        Truncations.Truncated t = Truncations.inRunes("hello world", 5);
        assertThat(t.value()).isEqualTo("hell…");
        assertThat(t.truncated()).isTrue();
    }

    @Test
    void shouldCountMultiByteCharactersAsOneRune() {
        assertThat(Truncations.inRunes("日本語テキスト", 4).value()).isEqualTo("日本語…");
        assertThat(Truncations.inRunes("日本語", 3).truncated()).isFalse();
    }

    @Test
    void shouldNeverSplitCharacterWhenTruncatingBytes() {
        Truncations.Truncated t = Truncations.inBytes("日本語", 7);
        assertThat(t.value()).isEqualTo("日…");
        assertThat(t.value().getBytes(StandardCharsets.UTF_8).length).isLessThanOrEqualTo(7);
    }

    @Test
    void shouldKeepTextFittingInBytes() {
        assertThat(Truncations.inBytes("abc", 3).truncated()).isFalse();
        assertThat(Truncations.inBytes("abcdef", 5).value()).isEqualTo("ab…");
    }

    @Test
    void shouldLeaveAlreadyTruncatedTextUnchanged() {
        for (String s : new String[]{"hello world", "日本語テキスト", "a😀b😀c😀d", "abcdef"}) {
            for (int n = 0; n <= 12; n++) {
                String runes = Truncations.inRunes(s, n).value();
                Truncations.Truncated again = Truncations.inRunes(runes, n);
                assertThat(again.value()).as("runes %s / %d", s, n).isEqualTo(runes);
                assertThat(again.truncated()).isFalse();

                String bytes = Truncations.inBytes(s, n).value();
                Truncations.Truncated againBytes = Truncations.inBytes(bytes, n);
                assertThat(againBytes.value()).as("bytes %s / %d", s, n).isEqualTo(bytes);
                assertThat(againBytes.truncated()).isFalse();
            }
        }
    }

    @Test
    void shouldCutBytesWithoutEllipsis() {
        Truncations.Truncated t = Truncations.cutBytes("日本語", 7);
        assertThat(t.value()).isEqualTo("日本");
        assertThat(t.truncated()).isTrue();
        assertThat(Truncations.cutBytes("abcd", 4).truncated()).isFalse();
    }
}
