package org.wxvisor.common.plugin;

import org.wxvisor.datamodel.AccessKind;
import org.wxvisor.datamodel.EncoderSettings;
import org.wxvisor.datamodel.answers.AnswerElement;

/**
 * The verification entry points available to question answerers.
 * A {@code null} address leaves the corresponding symbol unconstrained.
 */
public interface IWxvisor {

    AnswerElement smtBasicPaging(EncoderSettings settings, Long va, Long pa, AccessKind kind);

    AnswerElement smtAliasing(EncoderSettings settings, Long va, Long va1, Long va2, Long pa,
            AccessKind kind);

    AnswerElement smtSingleLevelWx(EncoderSettings settings, Long va, Long va1, Long va2,
            Long pa);

    AnswerElement smtWxvisor(EncoderSettings settings, Long va, Long va1, Long va2, Long ipa,
            Long pa);

    AnswerElement smtLeastPrivilege(EncoderSettings settings, Long va, Long ipa, Long pa,
            AccessKind kind);

}
