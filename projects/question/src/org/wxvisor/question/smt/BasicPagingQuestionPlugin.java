package org.wxvisor.question.smt;

import org.wxvisor.common.Answerer;
import org.wxvisor.common.plugin.IWxvisor;
import org.wxvisor.datamodel.answers.AnswerElement;
import org.wxvisor.datamodel.questions.Question;
import org.wxvisor.question.QuestionPlugin;

import java.util.Arrays;
import java.util.List;


public class BasicPagingQuestionPlugin extends QuestionPlugin {

    public static class BasicPagingAnswerer extends Answerer {

        public BasicPagingAnswerer(Question question, IWxvisor wxvisor) {
            super(question, wxvisor);
        }

        @Override
        public AnswerElement answer() {
            BasicPagingQuestion q = (BasicPagingQuestion) _question;
            return _wxvisor.smtBasicPaging(q.getSettings(), q.getVa(), q.getPa(),
                    q.getAccessKind());
        }
    }

    public static class BasicPagingQuestion extends AddressQuestion {

        private static final List<String> KEYS = Arrays.asList(VA_VAR, PA_VAR, ACCESS_KIND_VAR);

        @Override
        protected List<String> acceptedKeys() {
            return KEYS;
        }

        @Override
        public String getName() {
            return "smt-basic-paging";
        }
    }


    @Override
    protected Answerer createAnswerer(Question question, IWxvisor wxvisor) {
        return new BasicPagingAnswerer(question, wxvisor);
    }

    @Override
    protected Question createQuestion() {
        return new BasicPagingQuestion();
    }
}
