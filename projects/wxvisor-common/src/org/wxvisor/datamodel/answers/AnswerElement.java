package org.wxvisor.datamodel.answers;

import com.fasterxml.jackson.core.JsonProcessingException;

public interface AnswerElement {

    String prettyPrint() throws JsonProcessingException;

}
