package org.wxvisor.smt;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import java.util.Arrays;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

public class VerificationResultTest {

    private static VerificationResult result(Verdict v, QueryIntent i) {
        return new VerificationResult(v, i, null, null, null, new VerificationStats(1, 2, 3, 4L));
    }

    @Test
    public void verifiedDependsOnIntent() {
        assertThat(result(Verdict.SAT, QueryIntent.WITNESS).getVerified(), is(true));
        assertThat(result(Verdict.UNSAT, QueryIntent.WITNESS).getVerified(), is(false));
        assertThat(result(Verdict.UNSAT, QueryIntent.COUNTEREXAMPLE).getVerified(), is(true));
        assertThat(result(Verdict.SAT, QueryIntent.COUNTEREXAMPLE).getVerified(), is(false));
        assertThat(result(Verdict.UNKNOWN, QueryIntent.WITNESS).getVerified(), is(false));
        assertThat(result(Verdict.UNKNOWN, QueryIntent.COUNTEREXAMPLE).getVerified(), is(false));
    }

    @Test
    public void prettyPrintListsWitness() {
        SortedMap<String, String> model = new TreeMap<>();
        model.put("va", "0x1000");
        model.put("mmu1(va)", "0x9000");
        VerificationResult r = new VerificationResult(Verdict.SAT, QueryIntent.WITNESS, model,
                null, null, null);
        assertThat(r.prettyPrint("  "), equalTo("sat\n  mmu1(va) -> 0x9000\n  va -> 0x1000\n"));
    }

    @Test
    public void prettyPrintListsCore() {
        VerificationResult r = new VerificationResult(Verdict.UNSAT, QueryIntent.WITNESS, null,
                Arrays.asList("a", "b"), null, null);
        assertThat(r.prettyPrint(""), equalTo("unsat\ncore: a, b\n"));
    }

    @Test
    public void jsonKeepsVerdictAndCore() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        VerificationResult r = new VerificationResult(Verdict.UNSAT,
                QueryIntent.COUNTEREXAMPLE, null, Arrays.asList("map mmu1(va) = pa"), null,
                new VerificationStats(2, 10, 20, 5L));
        VerificationResult back = mapper.readValue(mapper.writeValueAsString(r),
                VerificationResult.class);
        assertThat(back.getVerdict(), equalTo(Verdict.UNSAT));
        assertThat(back.getIntent(), equalTo(QueryIntent.COUNTEREXAMPLE));
        assertThat(back.getUnsatCore(), contains("map mmu1(va) = pa"));
        assertThat(back.getStatistics().getNumConstraints(), equalTo(20));
        assertThat(back.getVerified(), is(true));
    }
}
