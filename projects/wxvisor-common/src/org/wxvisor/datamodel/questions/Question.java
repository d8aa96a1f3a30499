package org.wxvisor.datamodel.questions;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;
import org.wxvisor.common.ConfigurationException;
import org.wxvisor.datamodel.EncoderSettings;
import org.wxvisor.datamodel.WxPolicy;

import java.util.Iterator;

/**
 * <p>Base class of every question. A question is configured from a JSON
 * parameter object; the keys common to all questions describe the
 * {@link EncoderSettings} of the encoding the question will build.</p>
 */
public abstract class Question {

    private static final String ADDRESS_WIDTH_VAR = "addressWidth";

    private static final String PAGE_OFFSET_BITS_VAR = "pageOffsetBits";

    private static final String TIMEOUT_VAR = "timeout";

    private static final String UNSAT_CORE_VAR = "unsatCore";

    private static final String WX_POLICY_VAR = "wxPolicy";

    private final EncoderSettings _settings;

    public Question() {
        _settings = new EncoderSettings();
    }

    @JsonIgnore
    public abstract String getName();

    @JsonIgnore
    public EncoderSettings getSettings() {
        return _settings;
    }

    @JsonProperty(ADDRESS_WIDTH_VAR)
    public int getAddressWidth() {
        return _settings.getAddressWidth();
    }

    @JsonProperty(PAGE_OFFSET_BITS_VAR)
    public int getPageOffsetBits() {
        return _settings.getPageOffsetBits();
    }

    @JsonProperty(TIMEOUT_VAR)
    public int getTimeout() {
        return _settings.getTimeout();
    }

    @JsonProperty(UNSAT_CORE_VAR)
    public boolean getUnsatCore() {
        return _settings.getUnsatCore();
    }

    @JsonProperty(WX_POLICY_VAR)
    public WxPolicy getWxPolicy() {
        return _settings.getWxPolicy();
    }

    protected boolean isBaseParamKey(String paramKey) {
        switch (paramKey) {
            case ADDRESS_WIDTH_VAR:
            case PAGE_OFFSET_BITS_VAR:
            case TIMEOUT_VAR:
            case UNSAT_CORE_VAR:
            case WX_POLICY_VAR:
                return true;
            default:
                return false;
        }
    }

    /**
     * Reads the settings keys from the parameters. Subclasses override this,
     * call it first, and then handle their own keys.
     */
    public void setJsonParameters(JSONObject parameters) {
        Iterator<?> paramKeys = parameters.keys();

        while (paramKeys.hasNext()) {
            String paramKey = (String) paramKeys.next();
            if (!isBaseParamKey(paramKey)) {
                continue;
            }

            try {
                switch (paramKey) {
                    case ADDRESS_WIDTH_VAR:
                        _settings.setAddressWidth(parameters.getInt(paramKey));
                        break;
                    case PAGE_OFFSET_BITS_VAR:
                        _settings.setPageOffsetBits(parameters.getInt(paramKey));
                        break;
                    case TIMEOUT_VAR:
                        _settings.setTimeout(parameters.getInt(paramKey));
                        break;
                    case UNSAT_CORE_VAR:
                        _settings.setUnsatCore(parameters.getBoolean(paramKey));
                        break;
                    case WX_POLICY_VAR:
                        _settings.setWxPolicy(WxPolicy.fromName(parameters.getString(paramKey)));
                        break;
                    default:
                        break;
                }
            }
            catch (JSONException e) {
                throw new ConfigurationException("Bad value for parameter " + paramKey, e);
            }
        }

        _settings.validate();
    }

    protected String prettyPrintBase() {
        return String.format("%s width=%d pageOffsetBits=%d wxPolicy=%s ", getName(),
                getAddressWidth(), getPageOffsetBits(), getWxPolicy());
    }

    public String prettyPrint() {
        return prettyPrintBase().trim();
    }

    public String toJsonString() throws JsonProcessingException {
        return new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(this);
    }

}
