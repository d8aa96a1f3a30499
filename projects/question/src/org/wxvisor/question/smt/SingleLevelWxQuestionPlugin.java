package org.wxvisor.question.smt;

import org.wxvisor.common.Answerer;
import org.wxvisor.common.plugin.IWxvisor;
import org.wxvisor.datamodel.answers.AnswerElement;
import org.wxvisor.datamodel.questions.Question;
import org.wxvisor.question.QuestionPlugin;

import java.util.Arrays;
import java.util.List;


public class SingleLevelWxQuestionPlugin extends QuestionPlugin {

    public static class SingleLevelWxAnswerer extends Answerer {

        public SingleLevelWxAnswerer(Question question, IWxvisor wxvisor) {
            super(question, wxvisor);
        }

        @Override
        public AnswerElement answer() {
            SingleLevelWxQuestion q = (SingleLevelWxQuestion) _question;
            return _wxvisor.smtSingleLevelWx(q.getSettings(), q.getVa(), q.getVa1(), q.getVa2(),
                    q.getPa());
        }
    }

    public static class SingleLevelWxQuestion extends AddressQuestion {

        private static final List<String> KEYS = Arrays.asList(VA_VAR, VA1_VAR, VA2_VAR, PA_VAR);

        @Override
        protected List<String> acceptedKeys() {
            return KEYS;
        }

        @Override
        public String getName() {
            return "smt-wx";
        }
    }


    @Override
    protected Answerer createAnswerer(Question question, IWxvisor wxvisor) {
        return new SingleLevelWxAnswerer(question, wxvisor);
    }

    @Override
    protected Question createQuestion() {
        return new SingleLevelWxQuestion();
    }
}
