package org.wxvisor.smt.answers;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.wxvisor.datamodel.answers.AnswerElement;
import org.wxvisor.smt.VerificationResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The results of a battery of checks, in the order they were run.
 */
public class SmtManyAnswerElement implements AnswerElement {

    private static final String RESULT_VAR = "result";

    protected Map<String, VerificationResult> _result;

    public SmtManyAnswerElement() {
        _result = new LinkedHashMap<>();
    }

    @JsonProperty(RESULT_VAR)
    public Map<String, VerificationResult> getResult() {
        return _result;
    }

    @JsonProperty(RESULT_VAR)
    public void setResult(Map<String, VerificationResult> result) {
        _result = new LinkedHashMap<>(result);
    }

    public void addResult(String name, VerificationResult result) {
        _result.put(name, result);
    }

    /**
     * Every check came out as expected.
     */
    @JsonIgnore
    public boolean getVerified() {
        for (VerificationResult r : _result.values()) {
            if (!r.getVerified()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String prettyPrint() throws JsonProcessingException {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, VerificationResult> e : _result.entrySet()) {
            sb.append(e.getKey()).append(": ").append(e.getValue().prettyPrint("  "));
        }
        return sb.toString();
    }

}
