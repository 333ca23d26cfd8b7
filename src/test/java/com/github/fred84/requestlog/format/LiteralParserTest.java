package com.github.fred84.requestlog.format;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.NullNode;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LiteralParserTest {

    @Test
    void scalars() {
        assertThat(LiteralParser.parse("42")).hasValue(42);
        assertThat(LiteralParser.parse("-7")).hasValue(-7);
        assertThat(LiteralParser.parse("10000000000")).hasValue(10_000_000_000L);
        assertThat(LiteralParser.parse("123456789012345678901234567890"))
                .hasValue(new BigInteger("123456789012345678901234567890"));
        assertThat(LiteralParser.parse("2.5")).hasValue(2.5);
        assertThat(LiteralParser.parse("1e3")).hasValue(1000.0);
        assertThat(LiteralParser.parse("'it\\'s'")).hasValue("it's");
        assertThat(LiteralParser.parse("\"quoted\"")).hasValue("quoted");
        assertThat(LiteralParser.parse("False")).hasValue(false);
        assertThat(LiteralParser.parse("None")).hasValue(NullNode.getInstance());
    }

    @Test
    void containers() {
        assertThat(LiteralParser.parse("[1, 'a', [True]]")).hasValue(List.of(1, "a", List.of(true)));
        assertThat(LiteralParser.parse("{'a': 1, 2: 'b',}")).hasValue(Map.of("a", 1, "2", "b"));
        assertThat(LiteralParser.parse("(1, 2)")).hasValue(List.of(1, 2));
        assertThat(LiteralParser.parse("(1,)")).hasValue(List.of(1));
        assertThat(LiteralParser.parse("(1)")).hasValue(1);
        assertThat(LiteralParser.parse("()")).hasValue(List.of());
        assertThat(LiteralParser.parse("{}")).hasValue(Map.of());
    }

    @Test
    void invalidInputYieldsNothing() {
        assertThat(LiteralParser.parse("login")).isEmpty();
        assertThat(LiteralParser.parse("true")).isEmpty();
        assertThat(LiteralParser.parse("007")).isEmpty();
        assertThat(LiteralParser.parse("[1, 2")).isEmpty();
        assertThat(LiteralParser.parse("'open")).isEmpty();
        assertThat(LiteralParser.parse("{'a' 1}")).isEmpty();
        assertThat(LiteralParser.parse("1 2")).isEmpty();
        assertThat(LiteralParser.parse("")).isEmpty();
    }
}
