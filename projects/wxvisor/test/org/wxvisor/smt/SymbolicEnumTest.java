package org.wxvisor.smt;

import org.junit.Test;
import org.wxvisor.datamodel.EncoderSettings;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThrows;

public class SymbolicEnumTest {

    @Test
    public void indexWidthFitsTheLargestIndex() {
        assertThat(SymbolicEnum.indexWidth(1), equalTo(0));
        assertThat(SymbolicEnum.indexWidth(2), equalTo(1));
        assertThat(SymbolicEnum.indexWidth(3), equalTo(2));
        assertThat(SymbolicEnum.indexWidth(4), equalTo(2));
        assertThat(SymbolicEnum.indexWidth(5), equalTo(3));
        assertThat(SymbolicEnum.indexWidth(8), equalTo(3));
        assertThat(SymbolicEnum.indexWidth(9), equalTo(4));
    }

    @Test
    public void indexPastTheLastChoiceIsUnsat() {
        try (Encoder enc = new Encoder(new EncoderSettings(), 1)) {
            SymbolicEnum<String> e = new SymbolicEnum<>(enc, "colour",
                    Arrays.asList("red", "green", "blue"));
            assertThat(e.getIndex().getSortSize(), equalTo(2));
            enc.add("colour past blue", enc.Eq(e.getIndex(), enc.getCtx().mkBV(3, 2)));
            assertThat(enc.verify(QueryIntent.WITNESS).getVerdict(), equalTo(Verdict.UNSAT));
        }
    }

    @Test
    public void everyChoiceCanBeChosen() {
        for (String choice : Arrays.asList("red", "green", "blue")) {
            try (Encoder enc = new Encoder(new EncoderSettings(), 1)) {
                SymbolicEnum<String> e = new SymbolicEnum<>(enc, "colour",
                        Arrays.asList("red", "green", "blue"));
                enc.add("colour is " + choice, e.is(choice));
                assertThat(choice, enc.verify(QueryIntent.WITNESS).getVerdict(),
                        equalTo(Verdict.SAT));
            }
        }
    }

    @Test
    public void singleChoiceNeedsNoSymbol() {
        try (Encoder enc = new Encoder(new EncoderSettings(), 1)) {
            SymbolicEnum<String> e = new SymbolicEnum<>(enc, "only",
                    Collections.singletonList("red"));
            assertThat(e.getIndex(), nullValue());
            assertThat(e.is("red").isTrue(), is(true));
            assertThat(e.is("blue").isFalse(), is(true));
            assertThat(e.decode(0), equalTo("red"));
        }
    }

    @Test
    public void rejectsEmptyChoices() {
        try (Encoder enc = new Encoder(new EncoderSettings(), 1)) {
            assertThrows(IllegalArgumentException.class,
                    () -> new SymbolicEnum<>(enc, "none", Collections.emptyList()));
        }
    }
}
