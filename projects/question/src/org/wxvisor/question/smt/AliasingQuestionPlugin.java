package org.wxvisor.question.smt;

import org.wxvisor.common.Answerer;
import org.wxvisor.common.plugin.IWxvisor;
import org.wxvisor.datamodel.answers.AnswerElement;
import org.wxvisor.datamodel.questions.Question;
import org.wxvisor.question.QuestionPlugin;

import java.util.Arrays;
import java.util.List;


public class AliasingQuestionPlugin extends QuestionPlugin {

    public static class AliasingAnswerer extends Answerer {

        public AliasingAnswerer(Question question, IWxvisor wxvisor) {
            super(question, wxvisor);
        }

        @Override
        public AnswerElement answer() {
            AliasingQuestion q = (AliasingQuestion) _question;
            return _wxvisor.smtAliasing(q.getSettings(), q.getVa(), q.getVa1(), q.getVa2(),
                    q.getPa(), q.getAccessKind());
        }
    }

    public static class AliasingQuestion extends AddressQuestion {

        private static final List<String> KEYS =
                Arrays.asList(VA_VAR, VA1_VAR, VA2_VAR, PA_VAR, ACCESS_KIND_VAR);

        @Override
        protected List<String> acceptedKeys() {
            return KEYS;
        }

        @Override
        public String getName() {
            return "smt-aliasing";
        }
    }


    @Override
    protected Answerer createAnswerer(Question question, IWxvisor wxvisor) {
        return new AliasingAnswerer(question, wxvisor);
    }

    @Override
    protected Question createQuestion() {
        return new AliasingQuestion();
    }
}
