package org.wxvisor.question;

import org.codehaus.jettison.json.JSONObject;
import org.wxvisor.common.Answerer;
import org.wxvisor.common.plugin.IWxvisor;
import org.wxvisor.datamodel.answers.AnswerElement;
import org.wxvisor.datamodel.questions.Question;

/**
 * A named question together with the answerer that runs it. Plugins are
 * discovered with {@link java.util.ServiceLoader}.
 */
public abstract class QuestionPlugin {

    protected abstract Answerer createAnswerer(Question question, IWxvisor wxvisor);

    protected abstract Question createQuestion();

    public String getQuestionName() {
        return createQuestion().getName();
    }

    public Question parseQuestion(JSONObject parameters) {
        Question question = createQuestion();
        question.setJsonParameters(parameters);
        return question;
    }

    public AnswerElement answer(Question question, IWxvisor wxvisor) {
        return createAnswerer(question, wxvisor).answer();
    }
}
