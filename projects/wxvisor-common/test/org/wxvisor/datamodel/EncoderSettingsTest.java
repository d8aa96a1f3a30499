package org.wxvisor.datamodel;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;
import org.wxvisor.common.ConfigurationException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

public class EncoderSettingsTest {

    @Test
    public void defaults() {
        EncoderSettings s = new EncoderSettings();
        s.validate();
        assertThat(s.getAddressWidth(), equalTo(64));
        assertThat(s.getPageOffsetBits(), equalTo(12));
        assertThat(s.getWxPolicy(), equalTo(WxPolicy.EXCLUSIVE));
        assertThat(s.getUnsatCore(), is(false));
    }

    @Test
    public void fitsUnsignedValues() {
        EncoderSettings s = new EncoderSettings();
        assertThat(s.fits(-1L), is(true));
        s.setAddressWidth(32);
        assertThat(s.fits(0xffffffffL), is(true));
        assertThat(s.fits(0x100000000L), is(false));
        assertThat(s.fits(-1L), is(false));
    }

    @Test
    public void invalidSettings() {
        EncoderSettings width = new EncoderSettings();
        width.setAddressWidth(0);
        assertThrows(ConfigurationException.class, width::validate);

        EncoderSettings offset = new EncoderSettings();
        offset.setPageOffsetBits(64);
        assertThrows(ConfigurationException.class, offset::validate);

        EncoderSettings timeout = new EncoderSettings();
        timeout.setTimeout(-5);
        assertThrows(ConfigurationException.class, timeout::validate);

        EncoderSettings policy = new EncoderSettings();
        policy.setWxPolicy(null);
        assertThrows(ConfigurationException.class, policy::validate);
    }

    @Test
    public void copyIsIndependent() {
        EncoderSettings s = new EncoderSettings();
        EncoderSettings copy = new EncoderSettings(s);
        copy.setAddressWidth(32);
        assertThat(s.getAddressWidth(), equalTo(64));
    }

    @Test
    public void readsJson() throws Exception {
        EncoderSettings s = new ObjectMapper().readValue(
                "{\"addressWidth\": 48, \"wxPolicy\": \"TOGGLE\", \"timeout\": 100}",
                EncoderSettings.class);
        assertThat(s.getAddressWidth(), equalTo(48));
        assertThat(s.getWxPolicy(), equalTo(WxPolicy.TOGGLE));
        assertThat(s.getTimeout(), equalTo(100));
        assertThat(s.getPageOffsetBits(), equalTo(12));
    }
}
