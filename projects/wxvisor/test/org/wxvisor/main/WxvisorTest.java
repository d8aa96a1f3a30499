package org.wxvisor.main;

import org.junit.Test;
import org.wxvisor.datamodel.AccessKind;
import org.wxvisor.datamodel.EncoderSettings;
import org.wxvisor.smt.answers.SmtManyAnswerElement;
import org.wxvisor.smt.answers.SmtOneAnswerElement;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

public class WxvisorTest {

    private final Wxvisor _wxvisor = new Wxvisor();

    @Test
    public void basicPaging() throws Exception {
        SmtOneAnswerElement answer = (SmtOneAnswerElement) _wxvisor.smtBasicPaging(
                new EncoderSettings(), 0x12345000L, 0x9000L, AccessKind.WRITE);
        assertThat(answer.getResult().getVerified(), is(true));
        assertThat(answer.prettyPrint(), startsWith("basic-mapping(write): sat\n"));
        assertThat(answer.prettyPrint(), containsString("  mmu1(va) -> 0x9000\n"));
    }

    @Test
    public void basicPagingCoversEveryKind() {
        SmtManyAnswerElement answer = (SmtManyAnswerElement) _wxvisor.smtBasicPaging(
                new EncoderSettings(), 0x12345000L, 0x9000L, null);
        assertThat(answer.getResult().keySet(), contains("basic-mapping(read)",
                "basic-mapping(write)", "basic-mapping(execute)"));
        assertThat(answer.getVerified(), is(true));
    }

    @Test
    public void aliasingWithOneKind() {
        SmtManyAnswerElement answer = (SmtManyAnswerElement) _wxvisor.smtAliasing(
                new EncoderSettings(), 0x12345000L, 0x23456000L, null, null, AccessKind.WRITE);
        assertThat(answer.getResult().keySet(), contains("alias-permission-split",
                "alias-soundness(write)", "alias-access-split(write)"));
        assertThat(answer.getVerified(), is(true));
    }

    @Test
    public void singleLevelWx() {
        SmtManyAnswerElement answer = (SmtManyAnswerElement) _wxvisor.smtSingleLevelWx(
                new EncoderSettings(), 0x12345000L, 0x23456000L, null, null);
        assertThat(answer.getResult(), hasKey("write-and-execute"));
        assertThat(answer.getVerified(), is(true));
    }

    @Test
    public void wxvisor() {
        SmtManyAnswerElement answer = (SmtManyAnswerElement) _wxvisor.smtWxvisor(
                new EncoderSettings(), 0x12345000L, 0x23456000L, null, null, null);
        assertThat(answer.getResult().keySet(), hasItems("alias-mapping", "stage2-alias",
                "wx-enforcement(execute)", "alias-soundness(write)"));
        assertThat(answer.getVerified(), is(true));
    }

    @Test
    public void leastPrivilegeCoversWriteAndExecute() {
        SmtManyAnswerElement answer = (SmtManyAnswerElement) _wxvisor.smtLeastPrivilege(
                new EncoderSettings(), 0x1000L, 0x5000L, 0x9000L, null);
        assertThat(answer.getResult().keySet(), contains("least-privilege(write)",
                "wx-enforcement(write)", "least-privilege(execute)", "wx-enforcement(execute)"));
        assertThat(answer.getVerified(), is(true));
    }
}
