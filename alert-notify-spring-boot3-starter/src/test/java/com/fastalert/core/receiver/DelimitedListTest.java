package com.fastalert.core.receiver;

import com.fastalert.support.TestAlerts;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DelimitedListTest {

    @Test
    void shouldSplitOnCommaSemicolonAndNewline() {
        DelimitedList list = DelimitedList.parse("a@x.com, b@x.com;c@x.com\nd@x.com");
        assertThat(list.items()).containsExactly("a@x.com", "b@x.com", "c@x.com", "d@x.com");
    }

    @Test
    void shouldDropBlankItems() {
        assertThat(DelimitedList.parse(" ,; \n").isEmpty()).isTrue();
        assertThat(DelimitedList.parse(null).size()).isZero();
    }

    @Test
    void shouldAcceptJsonArrays() {
        Settings s = TestAlerts.settings("{\"users\": [\"u1\", \"u2\"], \"groups\": \"g1,g2\"}");
        assertThat(s.list("users").items()).containsExactly("u1", "u2");
        assertThat(s.list("groups").items()).containsExactly("g1", "g2");
        assertThat(s.list("missing").isEmpty()).isTrue();
    }
}
