package org.wxvisor.common;

import org.wxvisor.common.plugin.IWxvisor;
import org.wxvisor.datamodel.answers.AnswerElement;
import org.wxvisor.datamodel.questions.Question;

public abstract class Answerer {

    protected final Question _question;

    protected final IWxvisor _wxvisor;

    public Answerer(Question question, IWxvisor wxvisor) {
        _question = question;
        _wxvisor = wxvisor;
    }

    public abstract AnswerElement answer();

}
