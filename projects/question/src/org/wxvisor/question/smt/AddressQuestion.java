package org.wxvisor.question.smt;


import com.fasterxml.jackson.annotation.JsonProperty;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;
import org.wxvisor.common.ConfigurationException;
import org.wxvisor.datamodel.AccessKind;
import org.wxvisor.datamodel.questions.Question;

import java.util.Iterator;
import java.util.List;

/**
 * <p>A question about a set of named addresses. Addresses are given as hex
 * strings, with or without a {@code 0x} prefix; an address that is not given
 * stays free.</p>
 *
 * <p>Each question lists the keys it uses; any other key is rejected.</p>
 */
public abstract class AddressQuestion extends Question {

    protected static final String ACCESS_KIND_VAR = "accessKind";

    protected static final String IPA_VAR = "ipa";

    protected static final String PA_VAR = "pa";

    protected static final String VA_VAR = "va";

    protected static final String VA1_VAR = "va1";

    protected static final String VA2_VAR = "va2";

    private AccessKind _accessKind;

    private Long _ipa;

    private Long _pa;

    private Long _va;

    private Long _va1;

    private Long _va2;

    /**
     * The address and access keys this question reads, besides the settings keys.
     */
    protected abstract List<String> acceptedKeys();

    @JsonProperty(ACCESS_KIND_VAR)
    public AccessKind getAccessKind() {
        return _accessKind;
    }

    @JsonProperty(IPA_VAR)
    public Long getIpa() {
        return _ipa;
    }

    @JsonProperty(PA_VAR)
    public Long getPa() {
        return _pa;
    }

    @JsonProperty(VA_VAR)
    public Long getVa() {
        return _va;
    }

    @JsonProperty(VA1_VAR)
    public Long getVa1() {
        return _va1;
    }

    @JsonProperty(VA2_VAR)
    public Long getVa2() {
        return _va2;
    }

    @Override
    public void setJsonParameters(JSONObject parameters) {
        super.setJsonParameters(parameters);

        Iterator<?> paramKeys = parameters.keys();

        while (paramKeys.hasNext()) {
            String paramKey = (String) paramKeys.next();
            if (super.isBaseParamKey(paramKey)) {
                continue;
            }
            if (!acceptedKeys().contains(paramKey)) {
                throw new ConfigurationException("Unknown parameter " + paramKey +
                        " for question " + getName() + ", expected one of " + acceptedKeys());
            }

            try {
                switch (paramKey) {
                    case ACCESS_KIND_VAR:
                        _accessKind = AccessKind.fromName(parameters.getString(paramKey));
                        break;
                    case IPA_VAR:
                        _ipa = parseAddress(paramKey, parameters.get(paramKey));
                        break;
                    case PA_VAR:
                        _pa = parseAddress(paramKey, parameters.get(paramKey));
                        break;
                    case VA_VAR:
                        _va = parseAddress(paramKey, parameters.get(paramKey));
                        break;
                    case VA1_VAR:
                        _va1 = parseAddress(paramKey, parameters.get(paramKey));
                        break;
                    case VA2_VAR:
                        _va2 = parseAddress(paramKey, parameters.get(paramKey));
                        break;
                    default:
                        throw new ConfigurationException("Unknown parameter " + paramKey +
                                " for question " + getName());
                }
            }
            catch (JSONException e) {
                throw new ConfigurationException("Bad value for parameter " + paramKey, e);
            }
        }
    }

    static Long parseAddress(String key, Object value) {
        if (!(value instanceof String)) {
            throw new ConfigurationException("Address " + key + " must be a hex string, got " +
                    value);
        }
        String s = ((String) value).trim();
        if (s.startsWith("0x") || s.startsWith("0X")) {
            s = s.substring(2);
        }
        try {
            return Long.parseUnsignedLong(s, 16);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Address " + key + " is not a hex number: " + value,
                    e);
        }
    }

    @Override
    public String prettyPrint() {
        StringBuilder sb = new StringBuilder(prettyPrintBase());
        appendAddress(sb, VA_VAR, _va);
        appendAddress(sb, VA1_VAR, _va1);
        appendAddress(sb, VA2_VAR, _va2);
        appendAddress(sb, IPA_VAR, _ipa);
        appendAddress(sb, PA_VAR, _pa);
        if (_accessKind != null) {
            sb.append(ACCESS_KIND_VAR).append("=").append(_accessKind.label());
        }
        return sb.toString().trim();
    }

    private static void appendAddress(StringBuilder sb, String key, Long value) {
        if (value != null) {
            sb.append(key).append("=0x").append(Long.toHexString(value)).append(" ");
        }
    }
}
