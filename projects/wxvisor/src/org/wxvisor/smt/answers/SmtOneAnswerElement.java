package org.wxvisor.smt.answers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.wxvisor.datamodel.answers.AnswerElement;
import org.wxvisor.smt.VerificationResult;

public class SmtOneAnswerElement implements AnswerElement {

    private static final String NAME_VAR = "name";

    private static final String RESULT_VAR = "result";

    protected String _name;

    protected VerificationResult _result;

    @JsonCreator
    public SmtOneAnswerElement(@JsonProperty(NAME_VAR) String name,
            @JsonProperty(RESULT_VAR) VerificationResult result) {
        _name = name;
        _result = result;
    }

    @JsonProperty(NAME_VAR)
    public String getName() {
        return _name;
    }

    @JsonProperty(RESULT_VAR)
    public VerificationResult getResult() {
        return _result;
    }

    @Override
    public String prettyPrint() throws JsonProcessingException {
        return _name + ": " + _result.prettyPrint("  ");
    }
}
