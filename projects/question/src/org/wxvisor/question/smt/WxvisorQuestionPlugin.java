package org.wxvisor.question.smt;

import org.wxvisor.common.Answerer;
import org.wxvisor.common.plugin.IWxvisor;
import org.wxvisor.datamodel.answers.AnswerElement;
import org.wxvisor.datamodel.questions.Question;
import org.wxvisor.question.QuestionPlugin;

import java.util.Arrays;
import java.util.List;


public class WxvisorQuestionPlugin extends QuestionPlugin {

    public static class WxvisorAnswerer extends Answerer {

        public WxvisorAnswerer(Question question, IWxvisor wxvisor) {
            super(question, wxvisor);
        }

        @Override
        public AnswerElement answer() {
            WxvisorQuestion q = (WxvisorQuestion) _question;
            return _wxvisor.smtWxvisor(q.getSettings(), q.getVa(), q.getVa1(), q.getVa2(),
                    q.getIpa(), q.getPa());
        }
    }

    public static class WxvisorQuestion extends AddressQuestion {

        private static final List<String> KEYS =
                Arrays.asList(VA_VAR, VA1_VAR, VA2_VAR, IPA_VAR, PA_VAR);

        @Override
        protected List<String> acceptedKeys() {
            return KEYS;
        }

        @Override
        public String getName() {
            return "smt-wxvisor";
        }
    }


    @Override
    protected Answerer createAnswerer(Question question, IWxvisor wxvisor) {
        return new WxvisorAnswerer(question, wxvisor);
    }

    @Override
    protected Question createQuestion() {
        return new WxvisorQuestion();
    }
}
