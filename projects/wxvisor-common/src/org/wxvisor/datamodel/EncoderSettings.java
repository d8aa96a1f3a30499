package org.wxvisor.datamodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.wxvisor.common.ConfigurationException;

/**
 * <p>Configuration of a single symbolic encoding: the bit-width of every
 * address, the number of page-offset bits that must be zero in a page-aligned
 * address, the solver timeout, and the W^X policy.</p>
 *
 * <p>Settings are validated by {@link #validate()} before any symbol is
 * declared.</p>
 */
public class EncoderSettings {

    public static final int DEFAULT_ADDRESS_WIDTH = 64;

    public static final int DEFAULT_PAGE_OFFSET_BITS = 12;

    private static final String ADDRESS_WIDTH_VAR = "addressWidth";

    private static final String PAGE_OFFSET_BITS_VAR = "pageOffsetBits";

    private static final String TIMEOUT_VAR = "timeout";

    private static final String WX_POLICY_VAR = "wxPolicy";

    private static final String UNSAT_CORE_VAR = "unsatCore";

    private int _addressWidth;

    private int _pageOffsetBits;

    private int _timeout;

    private WxPolicy _wxPolicy;

    private boolean _unsatCore;

    public EncoderSettings() {
        _addressWidth = DEFAULT_ADDRESS_WIDTH;
        _pageOffsetBits = DEFAULT_PAGE_OFFSET_BITS;
        _timeout = 0;
        _wxPolicy = WxPolicy.EXCLUSIVE;
        _unsatCore = false;
    }

    public EncoderSettings(EncoderSettings other) {
        _addressWidth = other._addressWidth;
        _pageOffsetBits = other._pageOffsetBits;
        _timeout = other._timeout;
        _wxPolicy = other._wxPolicy;
        _unsatCore = other._unsatCore;
    }

    public void validate() {
        if (_addressWidth <= 0) {
            throw new ConfigurationException("Address width must be positive, got " +
                    _addressWidth);
        }
        if (_pageOffsetBits < 0 || _pageOffsetBits >= _addressWidth) {
            throw new ConfigurationException("Page offset bits must lie in [0, " +
                    _addressWidth + "), got " + _pageOffsetBits);
        }
        if (_timeout < 0) {
            throw new ConfigurationException("Timeout must not be negative, got " + _timeout);
        }
        if (_wxPolicy == null) {
            throw new ConfigurationException("Missing W^X policy");
        }
    }

    /**
     * Check that an unsigned 64-bit address value is representable
     * in the configured width.
     */
    public boolean fits(long value) {
        return _addressWidth >= Long.SIZE || (value >>> _addressWidth) == 0;
    }

    @JsonProperty(ADDRESS_WIDTH_VAR)
    public int getAddressWidth() {
        return _addressWidth;
    }

    @JsonProperty(PAGE_OFFSET_BITS_VAR)
    public int getPageOffsetBits() {
        return _pageOffsetBits;
    }

    @JsonProperty(TIMEOUT_VAR)
    public int getTimeout() {
        return _timeout;
    }

    @JsonProperty(WX_POLICY_VAR)
    public WxPolicy getWxPolicy() {
        return _wxPolicy;
    }

    @JsonProperty(UNSAT_CORE_VAR)
    public boolean getUnsatCore() {
        return _unsatCore;
    }

    @JsonProperty(ADDRESS_WIDTH_VAR)
    public void setAddressWidth(int addressWidth) {
        _addressWidth = addressWidth;
    }

    @JsonProperty(PAGE_OFFSET_BITS_VAR)
    public void setPageOffsetBits(int pageOffsetBits) {
        _pageOffsetBits = pageOffsetBits;
    }

    @JsonProperty(TIMEOUT_VAR)
    public void setTimeout(int timeout) {
        _timeout = timeout;
    }

    @JsonProperty(WX_POLICY_VAR)
    public void setWxPolicy(WxPolicy wxPolicy) {
        _wxPolicy = wxPolicy;
    }

    @JsonProperty(UNSAT_CORE_VAR)
    public void setUnsatCore(boolean unsatCore) {
        _unsatCore = unsatCore;
    }

    @Override
    public String toString() {
        return "width=" + _addressWidth + " pageOffsetBits=" + _pageOffsetBits + " timeout=" +
                _timeout + " wxPolicy=" + _wxPolicy + " unsatCore=" + _unsatCore;
    }
}
