package org.wxvisor.question.smt;

import org.wxvisor.common.Answerer;
import org.wxvisor.common.plugin.IWxvisor;
import org.wxvisor.datamodel.answers.AnswerElement;
import org.wxvisor.datamodel.questions.Question;
import org.wxvisor.question.QuestionPlugin;

import java.util.Arrays;
import java.util.List;


public class LeastPrivilegeQuestionPlugin extends QuestionPlugin {

    public static class LeastPrivilegeAnswerer extends Answerer {

        public LeastPrivilegeAnswerer(Question question, IWxvisor wxvisor) {
            super(question, wxvisor);
        }

        @Override
        public AnswerElement answer() {
            LeastPrivilegeQuestion q = (LeastPrivilegeQuestion) _question;
            return _wxvisor.smtLeastPrivilege(q.getSettings(), q.getVa(), q.getIpa(), q.getPa(),
                    q.getAccessKind());
        }
    }

    public static class LeastPrivilegeQuestion extends AddressQuestion {

        private static final List<String> KEYS =
                Arrays.asList(VA_VAR, IPA_VAR, PA_VAR, ACCESS_KIND_VAR);

        @Override
        protected List<String> acceptedKeys() {
            return KEYS;
        }

        @Override
        public String getName() {
            return "smt-least-privilege";
        }
    }


    @Override
    protected Answerer createAnswerer(Question question, IWxvisor wxvisor) {
        return new LeastPrivilegeAnswerer(question, wxvisor);
    }

    @Override
    protected Question createQuestion() {
        return new LeastPrivilegeQuestion();
    }
}
